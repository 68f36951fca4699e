package io.litesh.shell.cli.output;

import io.litesh.shell.cli.SqlHighlighter;
import io.litesh.shell.core.render.PagedPrinter;
import java.util.List;

/** Renders each row as {@code INSERT INTO tbl VALUES(...);}. */
public final class SqlInsertRenderer {
  static final String DEFAULT_TABLE = "tbl";

  private SqlInsertRenderer() {}

  public static void render(QueryResult result, PagedPrinter pager, boolean highlight) {
    for (List<Object> row : result.rows()) {
      String sql = insert(DEFAULT_TABLE, row);
      pager.println(highlight ? SqlHighlighter.highlight(sql).toAnsi() : sql);
      if (pager.isAborted()) return;
    }
  }

  static String insert(String table, List<Object> row) {
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(table).append(" VALUES(");
    for (int i = 0; i < row.size(); i++) {
      if (i > 0) sql.append(", ");
      sql.append(literal(row.get(i)));
    }
    return sql.append(");").toString();
  }

  static String literal(Object value) {
    if (value == null) return "NULL";
    if (value instanceof byte[] blob) return "X'" + ValueFormatter.hex(blob, "") + "'";
    if (value instanceof String text) return "'" + text.replace("'", "''") + "'";
    return String.valueOf(value);
  }
}
