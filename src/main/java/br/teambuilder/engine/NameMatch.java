package br.teambuilder.engine;

/** Resultado de comparar um nome digitado com um candidato do elenco. */
public record NameMatch(String match, double score, Confidence confidence, String reason) {

  static NameMatch none(String candidate) {
    return new NameMatch(candidate, 0, Confidence.LOW, "No significant similarity found");
  }
}
