package br.teambuilder.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Estado de alocação: times (com jogadores já carimbados com teamId), jogadores sem time,
 * grupos vigentes (customizados + mútuos) e o contexto necessário para movimentações.
 */
public record TeamAssignment(
    List<Team> teams,
    List<Player> unassigned,
    List<PlayerGroup> groups,
    LeagueConfig config,
    AvoidIndex avoids) {

  public TeamAssignment {
    teams = List.copyOf(teams);
    unassigned = List.copyOf(unassigned);
    groups = groups == null ? List.of() : List.copyOf(groups);
    Objects.requireNonNull(config, "config");
    avoids = avoids == null ? AvoidIndex.empty() : avoids;
  }

  /** playerId -> teamId (somente jogadores alocados). */
  public Map<String, String> assignments() {
    Map<String, String> m = new LinkedHashMap<>();
    for (Team t : teams) {
      for (Player p : t.players()) m.put(p.id(), t.id());
    }
    return m;
  }

  public Team team(String teamId) {
    for (Team t : teams) {
      if (t.id().equals(teamId)) return t;
    }
    return null;
  }

  public Team teamOf(String playerId) {
    for (Team t : teams) {
      if (t.contains(playerId)) return t;
    }
    return null;
  }

  public Player player(String playerId) {
    for (Team t : teams) {
      for (Player p : t.players()) {
        if (p.id().equals(playerId)) return p;
      }
    }
    for (Player p : unassigned) {
      if (p.id().equals(playerId)) return p;
    }
    return null;
  }

  public int assignedCount() {
    int n = 0;
    for (Team t : teams) n += t.size();
    return n;
  }

  public TeamAssignment withTeams(List<Team> newTeams) {
    return new TeamAssignment(newTeams, unassigned, groups, config, avoids);
  }
}
