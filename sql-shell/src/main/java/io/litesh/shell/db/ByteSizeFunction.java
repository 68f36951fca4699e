package io.litesh.shell.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import org.sqlite.Function;
import org.sqlite.core.Codes;

/**
 * {@code fmt_byte_size(n)}: formats a byte count with decimal units, e.g. {@code 999 B} or {@code
 * 1.50 kB}. NULL yields NULL.
 */
public final class ByteSizeFunction extends Function {
  public static final String NAME = "fmt_byte_size";

  private static final String[] UNITS = {"kB", "MB", "GB", "TB", "PB", "EB"};

  public static void install(Connection connection) throws SQLException {
    Function.create(connection, NAME, new ByteSizeFunction(), 1, Function.FLAG_DETERMINISTIC);
  }

  @Override
  protected void xFunc() throws SQLException {
    if (args() != 1) {
      throw new SQLException(NAME + " takes exactly one argument");
    }
    if (value_type(0) == Codes.SQLITE_NULL) {
      result();
      return;
    }
    result(format(value_long(0)));
  }

  /** Formats {@code bytes} using powers of 1000. */
  public static String format(long bytes) {
    double size = Math.abs((double) bytes);
    if (size < 1000) {
      return bytes + " B";
    }
    int unit = -1;
    while (size >= 1000 && unit < UNITS.length - 1) {
      size /= 1000;
      unit++;
    }
    String sign = bytes < 0 ? "-" : "";
    String number = String.format(Locale.ROOT, "%.2f", size);
    if (number.endsWith(".00")) {
      number = number.substring(0, number.length() - 3);
    }
    return sign + number + " " + UNITS[unit];
  }
}
