package io.litesh.shell;

import io.litesh.shell.cli.CommandDispatcher;
import io.litesh.shell.cli.ShellException;
import io.litesh.shell.cli.StatementExecutor;
import io.litesh.shell.cli.output.OutputMode;
import io.litesh.shell.cli.output.ResultPrinter;
import io.litesh.shell.core.OutputWriter;
import io.litesh.shell.db.SqliteDatabase;
import io.litesh.shell.settings.Settings;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "litesh",
    description = "Interactive SQLite shell with context-sensitive completion",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  @CommandLine.Parameters(
      index = "0",
      paramLabel = "FILE",
      description = "Database file to open, or :memory:")
  private String file;

  @CommandLine.Option(
      names = {"-c", "--command"},
      description = "Run the given SQL or dot-command and exit")
  private String command;

  @CommandLine.Option(
      names = {"-m", "--mode"},
      description = "Initial output mode: null, table, csv, sql or json (default: table)",
      converter = ModeConverter.class)
  private OutputMode mode = OutputMode.TABLE;

  @CommandLine.Option(names = "--settings", description = "Settings database")
  private Path settingsFile;

  @CommandLine.Option(names = "--history", description = "History file")
  private Path historyFile;

  @CommandLine.Option(names = "--no-highlight", description = "Disable syntax highlighting")
  private boolean noHighlight;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner")
  private boolean quiet;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    Path home = home();
    Path history = historyFile != null ? historyFile : home.resolve("history");
    Path settingsPath = settingsFile != null ? settingsFile : home.resolve("settings.db");

    try (Connection connection = SqliteDatabase.open(file);
        Settings settings = openSettings(settingsPath)) {
      if (command != null) {
        return runCommand(connection, settings);
      }
      try (Shell shell = new Shell(connection, settings, history, mode, !noHighlight)) {
        shell.run(quiet);
        return 0;
      }
    } catch (SQLException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private int runCommand(Connection connection, Settings settings) {
    OutputWriter out = OutputWriter.system();
    StatementExecutor executor =
        new StatementExecutor(connection, settings, new ResultPrinter(out, false, !noHighlight));
    executor.setMode(mode);
    try {
      new CommandDispatcher(connection, settings, executor, out, !noHighlight).dispatch(command);
      return 0;
    } catch (ShellException e) {
      out.error("Error: " + e.getMessage());
      return 1;
    }
  }

  private static Settings openSettings(Path path) throws SQLException {
    try {
      return Settings.open(path);
    } catch (SQLException e) {
      LOG.warn(
          "Cannot open settings database {}, hints will not persist: {}", path, e.getMessage());
      return Settings.inMemory();
    }
  }

  static Path home() {
    String configured = System.getProperty("litesh.home");
    if (configured != null && !configured.isBlank()) return Path.of(configured);
    return Path.of(System.getProperty("user.home"), ".litesh");
  }

  static final class ModeConverter implements CommandLine.ITypeConverter<OutputMode> {
    @Override
    public OutputMode convert(String value) {
      return OutputMode.parse(value)
          .orElseThrow(
              () ->
                  new CommandLine.TypeConversionException(
                      "unknown mode '" + value + "', expected null, table, csv, sql or json"));
    }
  }
}
