package io.litesh.shell.sql;

import io.litesh.parser.NodeKind;
import io.litesh.parser.SyntaxNode;
import io.litesh.parser.SyntaxTree;
import io.litesh.parser.query.QueryMatch;
import io.litesh.parser.query.TreeQuery;
import io.litesh.shell.catalog.CatalogAccessor;
import io.litesh.shell.catalog.PlanException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the CTEs and table aliases a statement defines.
 *
 * <p>CTE columns are discovered by asking the engine to plan each CTE body, left to right, with all
 * previously declared CTEs in scope. Nothing is executed. A CTE whose body is not a query yet gets
 * no columns.
 */
public final class NameResolver {
  private static final Logger LOG = LoggerFactory.getLogger(NameResolver.class);

  private static final TreeQuery CTES =
      TreeQuery.compile("(with_clause (cte (identifier) @name) @definition)");
  private static final TreeQuery ALIASES =
      TreeQuery.compile("(table_reference (identifier) @table . (alias (identifier) @alias))");

  private final CatalogAccessor catalog;

  public NameResolver(CatalogAccessor catalog) {
    this.catalog = catalog;
  }

  /** Resolves the names of {@code statement}, a node of {@code tree}. Never throws. */
  public QueryNames resolve(SyntaxTree tree, SyntaxNode statement) {
    return new QueryNames(resolveCtes(tree, statement), resolveAliases(tree, statement));
  }

  private Map<String, List<String>> resolveCtes(SyntaxTree tree, SyntaxNode statement) {
    List<QueryMatch> matches = new ArrayList<>(CTES.matches(statement));
    matches.sort(Comparator.comparingInt(m -> m.capture("definition").orElseThrow().start()));

    Map<String, List<String>> ctes = new LinkedHashMap<>();
    List<String> definitions = new ArrayList<>();
    for (QueryMatch match : matches) {
      SyntaxNode nameNode = match.capture("name").orElseThrow();
      SyntaxNode definition = match.capture("definition").orElseThrow();
      String name = tree.text(nameNode);
      if (name.isEmpty()) continue;

      List<String> columns = columnsOf(tree, definition, definitions);
      ctes.putIfAbsent(name, columns);
      definitions.add(tree.text(definition));
    }
    return ctes;
  }

  private List<String> columnsOf(SyntaxTree tree, SyntaxNode definition, List<String> previous) {
    Optional<List<String>> explicit = explicitColumns(tree, definition);
    if (explicit.isPresent()) return explicit.get();
    Optional<SyntaxNode> body = body(definition);
    if (body.isEmpty()) return List.of();
    return planColumns(trialFragment(tree, definition, previous, body.get()));
  }

  private Optional<List<String>> explicitColumns(SyntaxTree tree, SyntaxNode definition) {
    for (SyntaxNode child : definition.namedChildren()) {
      if (child.kind().equals(NodeKind.COLUMN_LIST)) {
        List<String> names = new ArrayList<>();
        for (SyntaxNode id : child.namedChildren()) {
          if (!id.isMissing()) names.add(tree.text(id));
        }
        return Optional.of(names);
      }
    }
    return Optional.empty();
  }

  private static Optional<SyntaxNode> body(SyntaxNode definition) {
    return definition.namedChildren().stream()
        .filter(child -> child.kind().equals(NodeKind.SELECT) && !child.isMissing())
        .findFirst();
  }

  private static String trialFragment(
      SyntaxTree tree, SyntaxNode definition, List<String> previous, SyntaxNode body) {
    String bodyText = tree.text(body);
    if (previous.isEmpty()) return bodyText;
    boolean recursive =
        definition
            .parent()
            .map(with -> with.children().stream().anyMatch(c -> c.kind().equals("RECURSIVE")))
            .orElse(false);
    return "WITH " + (recursive ? "RECURSIVE " : "") + String.join(", ", previous) + " " + bodyText;
  }

  private List<String> planColumns(String sql) {
    try {
      return catalog.planColumns(sql);
    } catch (PlanException e) {
      LOG.debug("CTE body did not plan: {}", e.getMessage());
      return List.of();
    }
  }

  private static Map<String, String> resolveAliases(SyntaxTree tree, SyntaxNode statement) {
    Map<String, String> aliases = new LinkedHashMap<>();
    for (QueryMatch match : ALIASES.matches(statement)) {
      String table = tree.text(match.capture("table").orElseThrow());
      String alias = tree.text(match.capture("alias").orElseThrow());
      if (table.isEmpty() || alias.isEmpty()) continue;
      aliases.putIfAbsent(alias, table);
    }
    return aliases;
  }
}
