package io.litesh.shell.core.render;

import io.litesh.shell.core.OutputWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders result rows as a bordered text table.
 *
 * <p>Single-line cells are truncated to {@value #MAX_CELL_WIDTH} characters with an ellipsis.
 * Multi-line cells (pretty-printed JSON) are never truncated and span several table lines.
 */
public final class TableRenderer {
  static final int MAX_CELL_WIDTH = 40;

  private TableRenderer() {}

  /** Renders rows through a pager configured from the environment. */
  public static void render(List<String> headers, List<List<String>> rows, OutputWriter out) {
    render(headers, rows, PagedPrinter.forOutput(out));
  }

  /**
   * Renders rows through the given pager.
   *
   * @param headers column names
   * @param rows row cells, each row holding one display string per column
   * @param pager destination
   */
  public static void render(List<String> headers, List<List<String>> rows, PagedPrinter pager) {
    int columns = headers.size();
    int[] widths = new int[columns];
    for (int c = 0; c < columns; c++) widths[c] = headers.get(c).length();

    List<List<String[]>> prepared = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      List<String[]> rowCells = new ArrayList<>(columns);
      for (int c = 0; c < columns; c++) {
        String cell = c < row.size() && row.get(c) != null ? row.get(c) : "";
        String[] lines = cell.split("\\n", -1);
        boolean noTruncate = lines.length > 1;
        rowCells.add(lines);
        for (String ln : lines) {
          int cap = noTruncate ? ln.length() : Math.min(MAX_CELL_WIDTH, ln.length());
          widths[c] = Math.max(widths[c], cap);
        }
      }
      prepared.add(rowCells);
    }

    String separator = separator(widths);
    pager.println(separator);
    printSingleLine(headers, widths, pager);
    pager.println(separator);
    for (List<String[]> rowCells : prepared) {
      int maxLines = 1;
      for (String[] cellLines : rowCells) maxLines = Math.max(maxLines, cellLines.length);
      for (int line = 0; line < maxLines; line++) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < columns; c++) {
          String[] cellLines = rowCells.get(c);
          String piece = line < cellLines.length ? cellLines[line] : "";
          String v = cellLines.length > 1 ? piece : truncate(piece, widths[c]);
          sb.append("| ").append(pad(v, widths[c])).append(" ");
        }
        sb.append("|");
        pager.println(sb.toString());
        if (pager.isAborted()) return;
      }
    }
    pager.println(separator);
  }

  private static String separator(int[] widths) {
    StringBuilder sep = new StringBuilder();
    for (int w : widths) {
      sep.append("+").append("-".repeat(w + 2));
    }
    return sep.append("+").toString();
  }

  private static void printSingleLine(List<String> cols, int[] widths, PagedPrinter pager) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < cols.size(); i++) {
      String v = truncate(cols.get(i), widths[i]);
      sb.append("| ").append(pad(v, widths[i])).append(" ");
    }
    sb.append("|");
    pager.println(sb.toString());
  }

  private static String pad(String s, int w) {
    if (s.length() >= w) return s;
    return s + " ".repeat(w - s.length());
  }

  static String truncate(String s, int w) {
    if (s.length() <= w) return s;
    if (w <= 1) return s.substring(0, w);
    return s.substring(0, w - 1) + "…"; // ellipsis character
  }
}
