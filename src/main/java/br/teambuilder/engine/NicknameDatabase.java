package br.teambuilder.engine;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * nicknames.json esperado:
 * {
 *   "names": [
 *     { "base": "michael", "formal": ["Michael"], "nicknames": ["Mike","Mick"], "diminutives": ["Mitch"] },
 *     ...
 *   ]
 * }
 *
 * Lookup bidirecional: cada variante (formal/apelido/diminutivo) aponta para o nome base
 * e para todas as outras variantes do mesmo nome. Chaves normalizadas (lowercase + sem acento).
 */
public final class NicknameDatabase {

  private static final String RESOURCE = "/nicknames.json";
  private static final Gson GSON = new Gson();

  private static volatile NicknameDatabase DEFAULTS;

  private final Map<String, Set<String>> variants;

  private NicknameDatabase(Map<String, Set<String>> variants) {
    this.variants = variants;
  }

  /** Tabela padrão do classpath (somente leitura; use copy() para customizar). */
  public static NicknameDatabase get() {
    NicknameDatabase v = DEFAULTS;
    if (v == null) {
      synchronized (NicknameDatabase.class) {
        v = DEFAULTS;
        if (v == null) {
          v = new NicknameDatabase(load(RESOURCE));
          DEFAULTS = v;
        }
      }
    }
    return v;
  }

  public NicknameDatabase copy() {
    Map<String, Set<String>> m = new HashMap<>();
    for (Map.Entry<String, Set<String>> e : variants.entrySet()) {
      m.put(e.getKey(), new LinkedHashSet<>(e.getValue()));
    }
    return new NicknameDatabase(m);
  }

  /** Variantes conhecidas do nome (sem incluir o próprio); vazio se desconhecido. */
  public Set<String> variantsOf(String name) {
    Set<String> s = variants.get(TextUtil.normalizeName(name));
    return s == null ? Set.of() : Collections.unmodifiableSet(s);
  }

  public boolean related(String a, String b) {
    String na = TextUtil.normalizeName(a);
    String nb = TextUtil.normalizeName(b);
    if (na.isEmpty() || nb.isEmpty()) return false;
    Set<String> va = variants.get(na);
    if (va == null) return false;
    if (va.contains(nb)) return true;
    Set<String> vb = variants.get(nb);
    if (vb == null) return false;
    for (String x : va) {
      if (vb.contains(x)) return true;
    }
    return false;
  }

  /** Mapeamento extra (ex.: apelido local de um jogador), nos dois sentidos. */
  public void addMapping(String baseName, List<String> names) {
    String base = TextUtil.normalizeName(baseName);
    if (base.isEmpty() || names == null) return;
    for (String raw : names) {
      String v = TextUtil.normalizeName(raw);
      if (v.isEmpty() || v.equals(base)) continue;
      link(variants, v, base);
      link(variants, base, v);
    }
  }

  // -------------------------
  // Load
  // -------------------------

  private static Map<String, Set<String>> load(String resourcePath) {
    JsonObject root = readResourceJson(resourcePath);
    Map<String, Set<String>> out = new HashMap<>();

    JsonArray arr = JsonUtil.getArray(root, "names");
    if (arr == null) return out;

    for (JsonElement el : arr) {
      if (!el.isJsonObject()) continue;
      JsonObject o = el.getAsJsonObject();

      String base = TextUtil.normalizeName(JsonUtil.getString(o, "base"));
      if (base.isEmpty()) continue;

      Set<String> all = new LinkedHashSet<>();
      all.add(base);
      addAll(all, JsonUtil.getArray(o, "formal"));
      addAll(all, JsonUtil.getArray(o, "nicknames"));
      addAll(all, JsonUtil.getArray(o, "diminutives"));

      for (String v : all) {
        for (String other : all) {
          if (!other.equals(v)) link(out, v, other);
        }
      }
    }
    return out;
  }

  private static void addAll(Set<String> into, JsonArray arr) {
    if (arr == null) return;
    for (JsonElement a : arr) {
      if (a == null || !a.isJsonPrimitive()) continue;
      String v = TextUtil.normalizeName(a.getAsString());
      if (!v.isEmpty()) into.add(v);
    }
  }

  private static void link(Map<String, Set<String>> m, String from, String to) {
    m.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
  }

  private static JsonObject readResourceJson(String resourcePath) {
    try (InputStream in = NicknameDatabase.class.getResourceAsStream(resourcePath)) {
      if (in == null) {
        throw new IllegalStateException("Resource nao encontrado no classpath: " + resourcePath);
      }
      String raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);

      JsonElement el = GSON.fromJson(raw, JsonElement.class);
      if (el == null || !el.isJsonObject()) {
        throw new IllegalStateException(resourcePath + " invalido: nao eh objeto JSON");
      }
      return el.getAsJsonObject();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Falha ao ler " + resourcePath + ": " + e.getMessage(), e);
    }
  }
}
