package io.litesh.shell.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names introduced by one statement.
 *
 * @param ctes CTE name as written to its projected column names, in declaration order; the list is
 *     empty when the CTE could not be planned
 * @param aliases alias to the literal text of the table or CTE it stands for, in source order
 */
public record QueryNames(Map<String, List<String>> ctes, Map<String, String> aliases) {

  public QueryNames {
    ctes = Collections.unmodifiableMap(new LinkedHashMap<>(ctes));
    aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
  }

  public static QueryNames empty() {
    return new QueryNames(Map.of(), Map.of());
  }
}
