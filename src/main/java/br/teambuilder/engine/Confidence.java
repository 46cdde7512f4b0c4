package br.teambuilder.engine;

import java.util.Locale;

/** Faixa de confiança de um match de nome; define a política de aceite. */
public enum Confidence {
  EXACT,
  HIGH,
  MEDIUM,
  LOW;

  /** exact/high: aceita direto; medium: aceita com aviso; low: só sugestão. */
  public boolean autoAccept() {
    return this != LOW;
  }

  public boolean needsReview() {
    return this == MEDIUM;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
