package io.litesh.shell.core;

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Sink for everything litesh prints: query results, dot-command listings and error messages.
 *
 * <p>Interactive sessions write both kinds of text to the terminal; batch runs keep errors on
 * stderr so that piped result rows stay clean.
 */
public interface OutputWriter {

  /** Writes one line of result or command text. */
  void println(String s);

  void printf(String fmt, Object... args);

  /** Writes a diagnostic such as a failed statement or a bad dot-command. */
  void error(String s);

  /** Results and errors both go to {@code out}. */
  static OutputWriter forPrintStream(PrintStream out) {
    return forPrintStream(out, out);
  }

  static OutputWriter forPrintStream(PrintStream out, PrintStream err) {
    return new OutputWriter() {
      @Override
      public void println(String s) {
        out.println(s);
      }

      @Override
      public void printf(String fmt, Object... args) {
        out.printf(fmt, args);
      }

      @Override
      public void error(String s) {
        err.println(s);
      }
    };
  }

  /**
   * Results and errors both go to {@code out}, flushed after every call so that rows show up
   * while the line editor waits for the next statement.
   */
  static OutputWriter forPrintWriter(PrintWriter out) {
    return new OutputWriter() {
      @Override
      public void println(String s) {
        out.println(s);
        out.flush();
      }

      @Override
      public void printf(String fmt, Object... args) {
        out.printf(fmt, args);
        out.flush();
      }

      @Override
      public void error(String s) {
        println(s);
      }
    };
  }

  /** The batch writer used when litesh runs non-interactively. */
  static OutputWriter system() {
    return forPrintStream(System.out, System.err);
  }
}
