package br.teambuilder.engine;

/**
 * Números de uma geração.
 *
 * conflictsDetected: pares avoid-vs-request presentes na entrada.
 * avoidViolations: pares que se evitam e terminaram no mesmo time (esperado: 0).
 * Pedidos de quem ficou sem time contam como quebrados; pedidos que não resolvem para ninguém não contam.
 */
public record GenerationStats(
    int totalPlayers,
    int assignedPlayers,
    int unassignedPlayers,
    int mustHaveHonored,
    int mustHaveBroken,
    int niceToHaveHonored,
    int niceToHaveBroken,
    int conflictsDetected,
    int avoidViolations,
    int groupsKeptTogether,
    int groupsSplit,
    int swapsApplied,
    long durationMs) {

  public int requestsHonored() {
    return mustHaveHonored + niceToHaveHonored;
  }

  public int requestsBroken() {
    return mustHaveBroken + niceToHaveBroken;
  }
}
