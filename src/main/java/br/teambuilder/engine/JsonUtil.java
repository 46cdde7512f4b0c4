package br.teambuilder.engine;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

public final class JsonUtil {

  private JsonUtil() {}

  public static JsonElement dig(JsonObject obj, String... path) {
    if (obj == null) return null;
    JsonElement cur = obj;
    for (String key : path) {
      if (cur == null || !cur.isJsonObject()) return null;
      JsonObject jo = cur.getAsJsonObject();
      if (!jo.has(key)) return null;
      cur = jo.get(key);
    }
    return cur;
  }

  public static String getString(JsonObject obj, String... path) {
    JsonElement el = dig(obj, path);
    if (el == null || el.isJsonNull() || !el.isJsonPrimitive()) return null;
    return el.getAsString();
  }

  public static Integer getInt(JsonObject obj, String... path) {
    JsonElement el = dig(obj, path);
    if (el == null || el.isJsonNull()) return null;
    try { return el.getAsInt(); } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ignored) { return null; }
  }

  public static Double getDouble(JsonObject obj, String... path) {
    JsonElement el = dig(obj, path);
    if (el == null || el.isJsonNull()) return null;
    try { return el.getAsDouble(); } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ignored) { return null; }
  }

  public static Boolean getBoolean(JsonObject obj, String... path) {
    JsonElement el = dig(obj, path);
    if (el == null || el.isJsonNull() || !el.isJsonPrimitive()) return null;
    if (el.getAsJsonPrimitive().isBoolean()) return el.getAsBoolean();
    String s = el.getAsString().trim();
    if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("yes") || s.equals("1")) return Boolean.TRUE;
    if (s.equalsIgnoreCase("false") || s.equalsIgnoreCase("no") || s.equals("0")) return Boolean.FALSE;
    return null;
  }

  public static JsonArray getArray(JsonObject obj, String... path) {
    JsonElement el = dig(obj, path);
    if (el == null || el.isJsonNull() || !el.isJsonArray()) return null;
    return el.getAsJsonArray();
  }

  /** Lista de strings não vazias; aceita array JSON ou string única separada por vírgula/ponto-e-vírgula. */
  public static List<String> getStringList(JsonObject obj, String... path) {
    List<String> out = new ArrayList<>();
    JsonElement el = dig(obj, path);
    if (el == null || el.isJsonNull()) return out;

    if (el.isJsonArray()) {
      for (JsonElement item : el.getAsJsonArray()) {
        if (item == null || item.isJsonNull() || !item.isJsonPrimitive()) continue;
        String s = item.getAsString().trim();
        if (!s.isEmpty()) out.add(s);
      }
      return out;
    }

    if (el.isJsonPrimitive()) {
      for (String part : el.getAsString().split("[,;]")) {
        String s = part.trim();
        if (!s.isEmpty()) out.add(s);
      }
    }
    return out;
  }

  public static JsonArray toArray(List<String> values) {
    JsonArray arr = new JsonArray();
    if (values != null) values.forEach(arr::add);
    return arr;
  }
}
