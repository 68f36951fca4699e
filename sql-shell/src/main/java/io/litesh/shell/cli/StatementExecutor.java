package io.litesh.shell.cli;

import io.litesh.parser.SqlParser;
import io.litesh.parser.SyntaxNode;
import io.litesh.parser.SyntaxTree;
import io.litesh.shell.cli.output.OutputMode;
import io.litesh.shell.cli.output.QueryResult;
import io.litesh.shell.cli.output.ResultPrinter;
import io.litesh.shell.db.SqliteDatabase;
import io.litesh.shell.settings.DataTypeHint;
import io.litesh.shell.settings.Settings;
import io.litesh.shell.sql.StatementSplitter;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs SQL input statement by statement and prints the rows each statement returns.
 *
 * <p>Top-level runs the parser could not make sense of are sent to SQLite as well, so that the
 * user sees the engine's own syntax error. Execution stops at the first failing unit.
 */
public final class StatementExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(StatementExecutor.class);

  private final Connection connection;
  private final Settings settings;
  private final ResultPrinter printer;
  private OutputMode mode = OutputMode.TABLE;

  public StatementExecutor(Connection connection, Settings settings, ResultPrinter printer) {
    this.connection = connection;
    this.settings = settings;
    this.printer = printer;
  }

  public OutputMode mode() {
    return mode;
  }

  public void setMode(OutputMode mode) {
    this.mode = mode;
  }

  /** Executes every statement of {@code input} in order. */
  public void execute(String input) throws ShellException {
    SyntaxTree tree = SqlParser.parse(input);
    for (SyntaxNode unit : StatementSplitter.executionUnits(tree)) {
      executeUnit(tree.text(unit));
    }
  }

  private void executeUnit(String sql) throws ShellException {
    LOG.debug("Executing {}", sql);
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      if (ps.getParameterMetaData().getParameterCount() > 0) {
        throw new ShellException("cannot run queries that require bind parameters");
      }
      if (ps.execute()) {
        try (ResultSet rs = ps.getResultSet()) {
          printer.print(read(rs), mode);
        }
      }
    } catch (SQLException e) {
      throw new ShellException(e.getMessage(), e);
    }
  }

  private QueryResult read(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int count = meta.getColumnCount();
    List<String> columns = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) columns.add(meta.getColumnLabel(i));

    List<List<Object>> rows = new ArrayList<>();
    while (rs.next()) {
      List<Object> row = new ArrayList<>(count);
      for (int i = 1; i <= count; i++) row.add(rs.getObject(i));
      rows.add(row);
    }
    return new QueryResult(columns, rows, hints(columns));
  }

  private List<Optional<DataTypeHint>> hints(List<String> columns) throws SQLException {
    int appId = SqliteDatabase.applicationId(connection);
    List<Optional<DataTypeHint>> hints = new ArrayList<>(columns.size());
    for (String column : columns) hints.add(settings.dataType(appId, column));
    return hints;
  }
}
