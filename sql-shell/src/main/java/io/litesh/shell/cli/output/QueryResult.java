package io.litesh.shell.cli.output;

import io.litesh.shell.settings.DataTypeHint;
import java.util.List;
import java.util.Optional;

/**
 * Rows read from one statement. Values are {@code null}, {@link Long}, {@link Integer}, {@link
 * Double}, {@link String} or {@code byte[]}.
 *
 * @param columns column labels
 * @param rows row values, one entry per column
 * @param hints display hint per column, same order as {@code columns}
 */
public record QueryResult(
    List<String> columns, List<List<Object>> rows, List<Optional<DataTypeHint>> hints) {

  public QueryResult {
    columns = List.copyOf(columns);
    rows = List.copyOf(rows);
    hints = List.copyOf(hints);
  }
}
