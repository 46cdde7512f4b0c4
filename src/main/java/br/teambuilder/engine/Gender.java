package br.teambuilder.engine;

import java.util.Locale;

public enum Gender {
  M,
  F,
  OTHER;

  /** Aceita "M"/"F"/"Other" e variações comuns; qualquer outro valor vira OTHER. */
  public static Gender parse(String raw) {
    String s = TextUtil.lowerDeaccent(raw);
    switch (s) {
      case "m":
      case "male":
      case "masculino":
        return M;
      case "f":
      case "female":
      case "feminino":
        return F;
      default:
        return OTHER;
    }
  }

  public String label() {
    return this == OTHER ? "Other" : name().toUpperCase(Locale.ROOT);
  }
}
