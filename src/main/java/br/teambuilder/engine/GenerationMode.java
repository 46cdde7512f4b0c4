package br.teambuilder.engine;

import java.util.Locale;

public enum GenerationMode {
  BALANCED,
  RANDOM,
  MANUAL;

  public static GenerationMode parse(String raw) {
    if (raw == null || raw.isBlank()) return BALANCED;
    String s = raw.trim().toLowerCase(Locale.ROOT);
    switch (s) {
      case "balanced":
        return BALANCED;
      case "random":
      case "randomized":
        return RANDOM;
      case "manual":
        return MANUAL;
      default:
        throw new IllegalArgumentException("Modo de geração desconhecido: " + raw);
    }
  }
}
