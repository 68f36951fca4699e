package io.litesh.shell.cli.output;

import java.util.Locale;
import java.util.Optional;

/** How statement results are printed. */
public enum OutputMode {
  /** Discard rows. */
  NULL,
  /** Bordered table with a header row. */
  TABLE,
  /** RFC 4180 CSV with a header line. */
  CSV,
  /** One {@code INSERT} statement per row. */
  SQL,
  /** One JSON object per row. */
  JSON;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<OutputMode> parse(String value) {
    if (value == null) return Optional.empty();
    for (OutputMode mode : values()) {
      if (mode.label().equals(value.trim().toLowerCase(Locale.ROOT))) return Optional.of(mode);
    }
    return Optional.empty();
  }
}
