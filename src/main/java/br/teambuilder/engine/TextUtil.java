package br.teambuilder.engine;

import java.text.Normalizer;
import java.util.Locale;

public final class TextUtil {

  private TextUtil() {}

  public static String deaccent(String s) {
    if (s == null) return null;
    String n = Normalizer.normalize(s, Normalizer.Form.NFD);
    return n.replaceAll("\\p{M}+", "");
  }

  public static String firstNonBlank(String... s) {
    if (s == null) return null;
    for (String v : s) {
      if (v != null && !v.isBlank()) return v;
    }
    return null;
  }

  public static String lowerDeaccent(String s) {
    if (s == null) return "";
    return deaccent(s).trim().toLowerCase(Locale.ROOT);
  }

  /** lower + sem acento + espaços internos colapsados ("  Ana   Maria " -> "ana maria"). */
  public static String normalizeName(String s) {
    return lowerDeaccent(s).replaceAll("\\s+", " ");
  }
}
