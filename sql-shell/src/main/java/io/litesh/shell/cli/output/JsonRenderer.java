package io.litesh.shell.cli.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import io.litesh.shell.core.render.PagedPrinter;
import java.util.List;

/** Renders each row as one JSON object keyed by column label. */
public final class JsonRenderer {
  private static final Gson GSON = new GsonBuilder().serializeNulls().create();

  private JsonRenderer() {}

  public static void render(QueryResult result, PagedPrinter pager) {
    for (List<Object> row : result.rows()) {
      pager.println(GSON.toJson(toJson(result.columns(), row)));
      if (pager.isAborted()) return;
    }
  }

  static JsonObject toJson(List<String> columns, List<Object> row) {
    JsonObject obj = new JsonObject();
    for (int i = 0; i < columns.size(); i++) {
      Object v = i < row.size() ? row.get(i) : null;
      String key = columns.get(i);
      if (v == null) {
        obj.add(key, JsonNull.INSTANCE);
      } else if (v instanceof Number n) {
        obj.addProperty(key, n);
      } else if (v instanceof byte[] blob) {
        obj.addProperty(key, ValueFormatter.hex(blob, ""));
      } else {
        obj.addProperty(key, String.valueOf(v));
      }
    }
    return obj;
  }
}
