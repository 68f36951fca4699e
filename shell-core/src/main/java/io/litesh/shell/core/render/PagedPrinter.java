package io.litesh.shell.core.render;

import io.litesh.shell.core.OutputWriter;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Simple, self-contained pager for long result tables.
 *
 * <p>Paging is controlled by the {@code litesh.pager} system property or the {@code LITESH_PAGER}
 * environment variable ({@code on}/{@code off}); by default it is enabled only when attached to a
 * console. The page size comes from {@code LITESH_PAGE_SIZE}.
 */
public final class PagedPrinter {
  private static final int DEFAULT_PAGE_SIZE = 24;
  private static final int MIN_PAGE_SIZE = 5;

  private final OutputWriter out;
  private final boolean enabled;
  private final int pageSize;
  private final InputStream in;
  private int lineCount = 0;
  private boolean aborted = false;

  private PagedPrinter(OutputWriter out, boolean enabled, int pageSize, InputStream in) {
    this.out = out;
    this.enabled = enabled;
    this.pageSize = Math.max(MIN_PAGE_SIZE, pageSize);
    this.in = in;
  }

  /** Creates a PagedPrinter for the given output writer with settings from the environment. */
  public static PagedPrinter forOutput(OutputWriter out) {
    return new PagedPrinter(out, decideEnabled(), decidePageSize(), System.in);
  }

  /** Creates a PagedPrinter with explicit settings, reading answers from {@code in}. */
  public static PagedPrinter create(
      OutputWriter out, boolean enabled, int pageSize, InputStream in) {
    return new PagedPrinter(out, enabled, pageSize, in);
  }

  /** Prints a line, pausing for the pager if the page is full. */
  public void println(String s) {
    if (aborted) return;
    out.println(s);
    if (!enabled) return;
    lineCount++;
    if (lineCount >= pageSize) {
      if (!promptMore()) {
        aborted = true;
        return;
      }
      lineCount = 0;
    }
  }

  /** Returns whether output has been aborted by the user. */
  public boolean isAborted() {
    return aborted;
  }

  private boolean promptMore() {
    try {
      out.printf("-- more -- (Enter: next, q: quit) ");
      int ch = in.read();
      // Drain until newline
      while (ch != -1 && ch != '\n') {
        if (ch == 'q' || ch == 'Q') {
          out.println("");
          return false;
        }
        ch = in.read();
      }
      out.println("");
      return ch != -1;
    } catch (IOException e) {
      return false;
    }
  }

  private static boolean decideEnabled() {
    Boolean fromProperty = parseSwitch(System.getProperty("litesh.pager"));
    if (fromProperty != null) return fromProperty;
    Boolean fromEnv = parseSwitch(System.getenv("LITESH_PAGER"));
    if (fromEnv != null) return fromEnv;
    // Default: enable only when attached to a console (interactive)
    return System.console() != null;
  }

  static Boolean parseSwitch(String value) {
    if (value == null) return null;
    String v = value.trim().toLowerCase(Locale.ROOT);
    if (v.equals("0") || v.equals("off") || v.equals("false")) return Boolean.FALSE;
    if (v.equals("1") || v.equals("on") || v.equals("true")) return Boolean.TRUE;
    return null;
  }

  private static int decidePageSize() {
    String env = System.getenv("LITESH_PAGE_SIZE");
    if (env != null) {
      try {
        return Math.max(MIN_PAGE_SIZE, Integer.parseInt(env.trim()));
      } catch (NumberFormatException e) {
        return DEFAULT_PAGE_SIZE;
      }
    }
    return DEFAULT_PAGE_SIZE;
  }
}
