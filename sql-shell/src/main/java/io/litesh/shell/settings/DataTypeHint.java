package io.litesh.shell.settings;

import java.util.Locale;
import java.util.Optional;

/** How values of a column are displayed. */
public enum DataTypeHint {
  /** Text holding JSON, pretty-printed in table mode. */
  JSON(0);

  private final int code;

  DataTypeHint(int code) {
    this.code = code;
  }

  /** The integer kept in the {@code type} column of the settings database. */
  public int code() {
    return code;
  }

  /** The name accepted and printed by {@code .hint}. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<DataTypeHint> fromCode(long code) {
    for (DataTypeHint hint : values()) {
      if (hint.code == code) return Optional.of(hint);
    }
    return Optional.empty();
  }

  public static Optional<DataTypeHint> parse(String value) {
    if (value == null) return Optional.empty();
    for (DataTypeHint hint : values()) {
      if (hint.label().equalsIgnoreCase(value.trim())) return Optional.of(hint);
    }
    return Optional.empty();
  }
}
