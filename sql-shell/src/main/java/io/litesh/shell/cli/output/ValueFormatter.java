package io.litesh.shell.cli.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.litesh.shell.settings.DataTypeHint;
import java.util.Optional;

/** Turns SQLite values into display text. */
public final class ValueFormatter {
  private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().create();

  private ValueFormatter() {}

  /** Display text of a value: {@code NULL}, numbers, text, or blobs as spaced hex bytes. */
  public static String display(Object value) {
    if (value == null) return "NULL";
    if (value instanceof byte[] blob) return hex(blob, " ");
    return String.valueOf(value);
  }

  /** Like {@link #display(Object)} but honouring the column's display hint. */
  public static String display(Object value, Optional<DataTypeHint> hint) {
    if (value instanceof String text && hint.orElse(null) == DataTypeHint.JSON) {
      return prettyJson(text).orElse(text);
    }
    return display(value);
  }

  /** Pretty-prints {@code text} when it is valid JSON. */
  public static Optional<String> prettyJson(String text) {
    try {
      JsonElement element = JsonParser.parseString(text);
      return Optional.of(PRETTY.toJson(element));
    } catch (JsonParseException e) {
      return Optional.empty();
    }
  }

  /** Two lower-case hex digits per byte, joined by {@code separator}. */
  public static String hex(byte[] blob, String separator) {
    StringBuilder sb = new StringBuilder(blob.length * (2 + separator.length()));
    for (int i = 0; i < blob.length; i++) {
      if (i > 0) sb.append(separator);
      sb.append(String.format("%02x", blob[i] & 0xff));
    }
    return sb.toString();
  }
}
