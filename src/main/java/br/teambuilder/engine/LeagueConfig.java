package br.teambuilder.engine;

/**
 * Configuração da liga.
 *
 * Pré-condição (validada por quem chama o engine, não aqui):
 *   minFemales + minMales <= maxTeamSize
 */
public record LeagueConfig(
    String id,
    String name,
    int maxTeamSize,
    int minFemales,
    int minMales,
    Integer targetTeams,
    boolean allowMixedGender) {

  public static final int DEFAULT_MAX_TEAM_SIZE = 12;

  public static LeagueConfig of(int maxTeamSize, int minFemales, int minMales, Integer targetTeams) {
    return new LeagueConfig("default", "Default League", maxTeamSize, minFemales, minMales, targetTeams, true);
  }

  public static LeagueConfig defaults() {
    return new LeagueConfig("default", "Default League", DEFAULT_MAX_TEAM_SIZE, 0, 0, null, true);
  }

  /** Número de slots de time: targetTeams se informado, senão ceil(jogadores / maxTeamSize). */
  public int teamCount(int playerCount) {
    if (targetTeams != null) return Math.max(0, targetTeams);
    if (maxTeamSize <= 0 || playerCount <= 0) return 0;
    return (playerCount + maxTeamSize - 1) / maxTeamSize;
  }

  public boolean quotasFeasible() {
    return minFemales + minMales <= maxTeamSize;
  }

  /**
   * Normaliza valores vindos de fora (limites iguais aos da tela de configuração):
   * maxTeamSize 2..30, mínimos 0..15, targetTeams até 50. targetTeams = 0 é mantido.
   */
  public LeagueConfig validate() {
    String vid = TextUtil.firstNonBlank(id, "default");
    String vname = TextUtil.firstNonBlank(name, "Default League").trim();
    if (vname.length() > 50) vname = vname.substring(0, 50);

    int max = clamp(maxTeamSize <= 0 ? DEFAULT_MAX_TEAM_SIZE : maxTeamSize, 2, 30);
    int minF = clamp(minFemales, 0, 15);
    int minM = clamp(minMales, 0, 15);
    Integer target = targetTeams == null ? null : clamp(targetTeams, 0, 50);

    return new LeagueConfig(vid, vname, max, minF, minM, target, allowMixedGender);
  }

  private static int clamp(int v, int lo, int hi) {
    return Math.max(lo, Math.min(hi, v));
  }
}
