package io.litesh.shell.cli;

import com.github.vertical_blank.sqlformatter.SqlFormatter;
import io.litesh.shell.catalog.CatalogException;
import io.litesh.shell.catalog.SqliteCatalog;
import io.litesh.shell.cli.output.OutputMode;
import io.litesh.shell.core.OutputWriter;
import io.litesh.shell.db.SqliteDatabase;
import io.litesh.shell.settings.DataTypeHint;
import io.litesh.shell.settings.Settings;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Routes one line of input to a dot-command or to the statement executor. */
public class CommandDispatcher {
  private static final String MODES = "null, table, csv, sql or json";

  private final Connection connection;
  private final SqliteCatalog catalog;
  private final Settings settings;
  private final StatementExecutor executor;
  private final OutputWriter io;
  private final boolean highlight;

  public CommandDispatcher(
      Connection connection,
      Settings settings,
      StatementExecutor executor,
      OutputWriter io,
      boolean highlight) {
    this.connection = connection;
    this.catalog = new SqliteCatalog(connection);
    this.settings = settings;
    this.executor = executor;
    this.io = io;
    this.highlight = highlight;
  }

  /**
   * Handles one input.
   *
   * @return false when the shell should exit
   * @throws ShellException when the input fails; nothing after the failing statement has run
   */
  public boolean dispatch(String line) throws ShellException {
    String input = line.trim();
    if (input.isEmpty()) return true;
    if (!input.startsWith(".")) {
      executor.execute(input);
      return true;
    }

    String[] parts = input.split("\\s+");
    String cmd = parts[0].toLowerCase(Locale.ROOT);
    List<String> args = Arrays.asList(parts).subList(1, parts.length);
    switch (cmd) {
      case ".tables" -> cmdTables();
      case ".schema" -> cmdSchema(args);
      case ".mode" -> cmdMode(args);
      case ".hint" -> cmdHint(args);
      case ".help" -> cmdHelp();
      case ".quit", ".exit" -> {
        return false;
      }
      default -> throw new ShellException("unknown command " + cmd + ", try .help");
    }
    return true;
  }

  private void cmdTables() throws ShellException {
    try {
      for (String table : catalog.listTables()) io.println(table);
    } catch (CatalogException e) {
      throw new ShellException(e.getMessage(), e);
    }
  }

  private void cmdSchema(List<String> args) throws ShellException {
    if (args.isEmpty()) throw new ShellException("provide a table name");
    String table = args.get(0);
    Optional<String> sql;
    try {
      sql = catalog.tableSql(table);
    } catch (CatalogException e) {
      throw new ShellException(e.getMessage(), e);
    }
    String stored =
        sql.orElseThrow(() -> new ShellException("table " + table + " does not exist"));
    String text = SqlFormatter.format(stored);
    io.println(highlight ? SqlHighlighter.highlight(text).toAnsi() : text);
  }

  private void cmdMode(List<String> args) throws ShellException {
    if (args.isEmpty()) {
      io.println(executor.mode().label());
      return;
    }
    OutputMode mode =
        OutputMode.parse(args.get(0))
            .orElseThrow(
                () -> new ShellException("unknown mode " + args.get(0) + ", expected " + MODES));
    executor.setMode(mode);
  }

  private void cmdHint(List<String> args) throws ShellException {
    if (args.size() != 2) throw new ShellException("usage: .hint COLUMN json|none");
    String column = args.get(0);
    String type = args.get(1);
    Optional<DataTypeHint> hint = DataTypeHint.parse(type);
    if (hint.isEmpty() && !type.equalsIgnoreCase("none")) {
      throw new ShellException("unknown type " + type + ", expected json or none");
    }
    try {
      settings.setDataType(SqliteDatabase.applicationId(connection), column, hint);
    } catch (SQLException e) {
      throw new ShellException("cannot store hint: " + e.getMessage(), e);
    }
  }

  private void cmdHelp() {
    io.println(".tables                 list tables");
    io.println(".schema NAME            show the CREATE statement of a table");
    io.println(".mode [MODE]            show or set the output mode (" + MODES + ")");
    io.println(".hint COLUMN json|none  set how a column is displayed");
    io.println(".help                   show this help");
    io.println(".quit, .exit            leave the shell");
    io.println("Anything else is run as SQL; separate statements with ';'.");
  }
}
