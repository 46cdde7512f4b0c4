package br.teambuilder.engine;

/** Resultado de uma movimentação manual; se rejeitada, assignment é o estado original. */
public record MoveResult(boolean accepted, String reason, TeamAssignment assignment) {

  public static final String OK = "ok";
  public static final String NO_CHANGE = "no-change";
  public static final String TEAM_FULL = "team-full";
  public static final String AVOID_CONFLICT = "avoid-conflict";
  public static final String GROUP_SPLIT = "group-split";

  static MoveResult ok(TeamAssignment a) {
    return new MoveResult(true, OK, a);
  }

  static MoveResult rejected(String reason, TeamAssignment original) {
    return new MoveResult(false, reason, original);
  }
}
