package br.teambuilder.engine;

import java.util.List;

/** Saída completa de TeamGenerator.generate. */
public record GenerationResult(
    GenerationMode mode,
    TeamAssignment assignment,
    GroupFormationResult formation,
    SkillBalancer.BalanceReport balance,
    GenerationStats stats) {

  public List<Team> teams() {
    return assignment.teams();
  }

  public List<Player> unassigned() {
    return assignment.unassigned();
  }

  /** Grupos customizados seguidos dos formados por pedidos mútuos. */
  public List<PlayerGroup> groups() {
    return assignment.groups();
  }
}
