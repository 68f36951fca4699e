package io.litesh.shell.cli.output;

import io.litesh.shell.core.render.PagedPrinter;
import java.util.ArrayList;
import java.util.List;

/** CSV renderer for query results. RFC 4180 compliant. */
public final class CsvRenderer {
  private CsvRenderer() {}

  public static void render(QueryResult result, PagedPrinter pager) {
    pager.println(toCsvLine(result.columns()));
    for (List<Object> row : result.rows()) {
      List<String> values = new ArrayList<>(row.size());
      for (Object v : row) {
        values.add(toCsvCell(v));
      }
      pager.println(toCsvLine(values));
      if (pager.isAborted()) return;
    }
  }

  private static String toCsvLine(List<String> values) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) sb.append(',');
      sb.append(escapeCsv(values.get(i)));
    }
    return sb.toString();
  }

  private static String toCsvCell(Object v) {
    if (v == null) return "";
    if (v instanceof byte[] blob) return ValueFormatter.hex(blob, "");
    return String.valueOf(v);
  }

  static String escapeCsv(String s) {
    if (s == null) return "";
    if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
      return '"' + s.replace("\"", "\"\"") + '"';
    }
    return s;
  }
}
