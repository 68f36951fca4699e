package io.litesh.shell.cli.output;

import io.litesh.shell.core.OutputWriter;
import io.litesh.shell.core.render.PagedPrinter;
import io.litesh.shell.core.render.TableRenderer;
import java.util.ArrayList;
import java.util.List;

/** Prints query results in the selected {@link OutputMode}. */
public final class ResultPrinter {
  private final OutputWriter out;
  private final boolean paging;
  private final boolean highlight;

  /**
   * @param paging page long output on the console
   * @param highlight color SQL output
   */
  public ResultPrinter(OutputWriter out, boolean paging, boolean highlight) {
    this.out = out;
    this.paging = paging;
    this.highlight = highlight;
  }

  public void print(QueryResult result, OutputMode mode) {
    PagedPrinter pager =
        paging ? PagedPrinter.forOutput(out) : PagedPrinter.create(out, false, 0, System.in);
    switch (mode) {
      case NULL -> {}
      case TABLE -> TableRenderer.render(result.columns(), displayRows(result), pager);
      case CSV -> CsvRenderer.render(result, pager);
      case SQL -> SqlInsertRenderer.render(result, pager, highlight);
      case JSON -> JsonRenderer.render(result, pager);
    }
  }

  private static List<List<String>> displayRows(QueryResult result) {
    List<List<String>> rows = new ArrayList<>(result.rows().size());
    for (List<Object> row : result.rows()) {
      List<String> cells = new ArrayList<>(row.size());
      for (int i = 0; i < row.size(); i++) {
        cells.add(ValueFormatter.display(row.get(i), result.hints().get(i)));
      }
      rows.add(cells);
    }
    return rows;
  }
}
