package io.litesh.shell;

import io.litesh.shell.catalog.SqliteCatalog;
import io.litesh.shell.cli.CommandDispatcher;
import io.litesh.shell.cli.ShellCompleter;
import io.litesh.shell.cli.SqlHighlighter;
import io.litesh.shell.cli.SqlHintWidgets;
import io.litesh.shell.cli.StatementExecutor;
import io.litesh.shell.cli.completion.CompletionEngine;
import io.litesh.shell.cli.output.OutputMode;
import io.litesh.shell.cli.output.ResultPrinter;
import io.litesh.shell.core.OutputWriter;
import io.litesh.shell.settings.Settings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.HashMap;
import java.util.Map;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The interactive read-eval-print loop. */
public final class Shell implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Shell.class);
  private static final String PROMPT = ">> ";

  private final Terminal terminal;
  private final LineReader lineReader;
  private final DefaultHistory history;
  private final CommandDispatcher dispatcher;
  private boolean running = true;

  public Shell(
      Connection connection,
      Settings settings,
      Path historyFile,
      OutputMode mode,
      boolean highlight)
      throws IOException {
    this.terminal = TerminalBuilder.builder().system(true).build();
    try {
      Files.createDirectories(historyFile.toAbsolutePath().getParent());
    } catch (IOException e) {
      LOG.warn("Cannot create history directory for {}: {}", historyFile, e.getMessage());
    }
    this.history = new DefaultHistory();
    Map<String, Object> vars = new HashMap<>();
    vars.put(LineReader.HISTORY_FILE, historyFile);

    DefaultParser parser = new DefaultParser();
    parser.setEscapeChars(null);

    CompletionEngine engine = new CompletionEngine(new SqliteCatalog(connection));
    LineReaderBuilder builder =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variables(vars)
            .history(history)
            .parser(parser)
            .completer(new ShellCompleter(engine))
            .option(LineReader.Option.CASE_INSENSITIVE, true);
    if (highlight) {
      builder.highlighter(new SqlHighlighter());
    }
    this.lineReader = builder.build();
    new SqlHintWidgets(lineReader, engine);

    OutputWriter io = OutputWriter.forPrintWriter(terminal.writer());
    StatementExecutor executor =
        new StatementExecutor(connection, settings, new ResultPrinter(io, true, highlight));
    executor.setMode(mode);
    this.dispatcher = new CommandDispatcher(connection, settings, executor, io, highlight);
  }

  public void run(boolean quiet) {
    if (!quiet) printBanner();

    while (running) {
      try {
        String input = lineReader.readLine(PROMPT);
        if (input == null || input.isBlank()) continue;
        running = dispatcher.dispatch(input);
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
        terminal.flush();
      } catch (EndOfFileException e) {
        terminal.writer().println();
        terminal.flush();
        running = false;
      } catch (Exception e) {
        terminal.writer().println("Error: " + e.getMessage());
        terminal.flush();
      }
    }
  }

  private void printBanner() {
    terminal.writer().println("litesh - interactive SQLite shell");
    terminal.writer().println("Type '.help' for commands, '.quit' to quit");
    terminal.writer().println();
    terminal.flush();
  }

  @Override
  public void close() throws IOException {
    try {
      history.save();
    } catch (IOException e) {
      LOG.warn("Cannot save history: {}", e.getMessage());
    }
    terminal.close();
  }
}
