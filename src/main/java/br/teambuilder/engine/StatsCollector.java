package br.teambuilder.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Estatísticas sobre a composição final. Não altera nada: rodar duas vezes sobre o mesmo
 * estado dá o mesmo resultado.
 *
 * Pedidos são re-resolvidos contra o elenco inteiro com limiar fixo (0.8) e só então
 * comparados com o time do jogador encontrado.
 */
public final class StatsCollector {

  public static final double ACCEPTANCE_THRESHOLD = 0.8;

  private final NameResolver resolver;

  public StatsCollector(NameResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public GenerationStats collect(TeamAssignment state, int conflictsDetected, int swapsApplied, long durationMs) {
    Objects.requireNonNull(state, "state");

    List<Player> roster = new ArrayList<>();
    for (Team t : state.teams()) roster.addAll(t.players());
    roster.addAll(state.unassigned());

    int mustOk = 0;
    int mustBroken = 0;
    int niceOk = 0;
    int niceBroken = 0;

    for (Player p : roster) {
      Team mine = state.teamOf(p.id());
      List<String> requests = p.teammateRequests();
      for (int i = 0; i < requests.size(); i++) {
        Player target = resolver.bestPlayer(requests.get(i), roster, ACCEPTANCE_THRESHOLD, p.id());
        if (target == null) continue;

        boolean honored = mine != null && mine.contains(target.id());
        if (RequestPriority.ofIndex(i) == RequestPriority.MUST_HAVE) {
          if (honored) mustOk++;
          else mustBroken++;
        } else {
          if (honored) niceOk++;
          else niceBroken++;
        }
      }
    }

    int kept = 0;
    int split = 0;
    for (PlayerGroup g : state.groups()) {
      Set<String> teamIds = new HashSet<>();
      for (String pid : g.playerIds()) {
        Team t = state.teamOf(pid);
        teamIds.add(t == null ? "" : t.id());
      }
      if (teamIds.size() <= 1) kept++;
      else split++;
    }

    int assigned = state.assignedCount();
    return new GenerationStats(
        roster.size(),
        assigned,
        state.unassigned().size(),
        mustOk,
        mustBroken,
        niceOk,
        niceBroken,
        conflictsDetected,
        avoidViolations(state),
        kept,
        split,
        swapsApplied,
        durationMs);
  }

  public GenerationStats collect(TeamAssignment state) {
    return collect(state, 0, 0, 0L);
  }

  /** Pares (não ordenados) no mesmo time em que pelo menos um evita o outro. */
  public static int avoidViolations(TeamAssignment state) {
    AvoidIndex avoids = state.avoids();
    int n = 0;
    for (Team t : state.teams()) {
      List<Player> ps = t.players();
      for (int i = 0; i < ps.size(); i++) {
        for (int j = i + 1; j < ps.size(); j++) {
          if (avoids.conflict(ps.get(i).id(), ps.get(j).id())) n++;
        }
      }
    }
    return n;
  }
}
