package br.teambuilder.engine;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Regras de gênero de um time.
 *
 * Cota "alcançável": depois de inserir, ainda dá para chegar nos mínimos usando as vagas
 * que sobram (count[g] + vagasRestantes >= min[g], para F e M).
 */
final class GenderQuota {

  private GenderQuota() {}

  static boolean achievableAfter(Team team, Collection<Player> incoming, Collection<Player> outgoing, LeagueConfig config) {
    Map<Gender, Integer> counts = new EnumMap<>(team.genderBreakdown());
    for (Player p : outgoing) counts.merge(p.gender(), -1, Integer::sum);
    for (Player p : incoming) counts.merge(p.gender(), 1, Integer::sum);

    int size = team.size() - outgoing.size() + incoming.size();
    int remaining = config.maxTeamSize() - size;
    if (remaining < 0) return false;

    if (counts.getOrDefault(Gender.F, 0) + remaining < config.minFemales()) return false;
    if (counts.getOrDefault(Gender.M, 0) + remaining < config.minMales()) return false;

    if (!config.allowMixedGender()) {
      Gender only = null;
      for (Map.Entry<Gender, Integer> e : counts.entrySet()) {
        if (e.getValue() <= 0) continue;
        if (only != null) return false;
        only = e.getKey();
      }
    }
    return true;
  }

  static boolean achievableAfter(Team team, Collection<Player> incoming, LeagueConfig config) {
    return achievableAfter(team, incoming, List.of(), config);
  }
}
