package br.teambuilder.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Balanceamento guloso por trocas 1x1 entre times (só após a alocação balanceada).
 *
 * Cada passada:
 *  1) ordena os times por média; se (maior - menor) < spreadThreshold, para
 *  2) pares candidatos: vizinhos na ordenação + (mais fraco, mais forte)
 *  3) amostra até sampleSize jogadores sem grupo de cada lado, espalhados pelo ranking
 *  4) avalia cada troca (fraco do time fraco x forte do time forte) e guarda só a melhor
 *  5) aplica a melhor se o ganho passar de minImprovement; senão, fim
 *
 * Nunca mexe em jogador de grupo, nunca cria avoid e nunca torna a cota de gênero inalcançável.
 * Não garante variância mínima.
 */
public final class SkillBalancer {

  private static final Logger log = LoggerFactory.getLogger(SkillBalancer.class);

  /** Troca aplicada: weakPlayerId foi para strongTeamId e strongPlayerId para weakTeamId. */
  public record Swap(String weakTeamId, String strongTeamId, String weakPlayerId, String strongPlayerId, double gain) {}

  public record BalanceReport(TeamAssignment assignment, List<Swap> swaps, int passes, double finalSpread) {

    public BalanceReport {
      swaps = List.copyOf(swaps);
    }

    public int swapCount() {
      return swaps.size();
    }
  }

  private final EngineSettings settings;

  public SkillBalancer() {
    this(EngineSettings.defaults());
  }

  public SkillBalancer(EngineSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public BalanceReport balance(TeamAssignment state) {
    Objects.requireNonNull(state, "state");
    TeamAssignment current = state;
    List<Swap> swaps = new ArrayList<>();
    int passes = 0;

    while (passes < settings.balancerMaxPasses()) {
      List<Team> sorted = nonEmptySorted(current.teams());
      if (sorted.size() < 2) break;
      if (spread(sorted) < settings.balancerSpreadThreshold()) break;
      passes++;

      Candidate best = null;
      for (int[] pair : pairs(sorted.size())) {
        Candidate c = bestSwap(sorted.get(pair[0]), sorted.get(pair[1]), current);
        if (c != null && (best == null || c.gain > best.gain)) best = c;
      }

      if (best == null || best.gain < settings.balancerMinImprovement()) {
        log.debug("Balanceamento: passada {} sem troca útil", passes);
        break;
      }

      current = applySwap(current, best);
      swaps.add(new Swap(best.weak.id(), best.strong.id(), best.out.id(), best.in.id(), best.gain));
      log.debug("Troca {}: {} ({}) <-> {} ({}), ganho {}",
          passes, best.out.name(), best.weak.id(), best.in.name(), best.strong.id(), String.format("%.3f", best.gain));
    }

    double finalSpread = spread(nonEmptySorted(current.teams()));
    return new BalanceReport(current, swaps, passes, finalSpread);
  }

  // -------------------------
  // Busca
  // -------------------------

  private static final class Candidate {
    final Team weak;
    final Team strong;
    final Player out; // sai do fraco
    final Player in; // sai do forte
    final double gain;

    Candidate(Team weak, Team strong, Player out, Player in, double gain) {
      this.weak = weak;
      this.strong = strong;
      this.out = out;
      this.in = in;
      this.gain = gain;
    }
  }

  private Candidate bestSwap(Team weak, Team strong, TeamAssignment state) {
    if (weak.averageSkill() >= strong.averageSkill()) return null;

    List<Player> fromWeak = sample(weak);
    List<Player> fromStrong = sample(strong);
    double oldGap = Math.abs(strong.averageSkill() - weak.averageSkill());
    double oldRole = roleDeviation(weak.handlerCount()) + roleDeviation(strong.handlerCount());

    Candidate best = null;
    for (Player w : fromWeak) {
      for (Player s : fromStrong) {
        if (w.effectiveSkill() >= s.effectiveSkill()) continue;
        if (!legal(weak, strong, w, s, state)) continue;

        double delta = s.effectiveSkill() - w.effectiveSkill();
        double newWeakAvg = weak.averageSkill() + delta / weak.size();
        double newStrongAvg = strong.averageSkill() - delta / strong.size();
        double newGap = Math.abs(newStrongAvg - newWeakAvg);
        if (newGap > oldGap) continue;

        int hw = weak.handlerCount() - (w.handler() ? 1 : 0) + (s.handler() ? 1 : 0);
        int hs = strong.handlerCount() - (s.handler() ? 1 : 0) + (w.handler() ? 1 : 0);
        double newRole = roleDeviation(hw) + roleDeviation(hs);

        double gain = (oldGap - newGap) + settings.roleWeight() * (oldRole - newRole);
        if (best == null || gain > best.gain) best = new Candidate(weak, strong, w, s, gain);
      }
    }
    return best;
  }

  private boolean legal(Team weak, Team strong, Player w, Player s, TeamAssignment state) {
    AvoidIndex avoids = state.avoids();
    List<Player> weakRest = weak.players().stream().filter(p -> !p.id().equals(w.id())).toList();
    List<Player> strongRest = strong.players().stream().filter(p -> !p.id().equals(s.id())).toList();
    if (avoids.conflictsWithAny(s, weakRest)) return false;
    if (avoids.conflictsWithAny(w, strongRest)) return false;

    if (w.gender() == s.gender()) return true;
    LeagueConfig config = state.config();
    if (!config.allowMixedGender()) return false;
    return GenderQuota.achievableAfter(weak, List.of(s), List.of(w), config)
        && GenderQuota.achievableAfter(strong, List.of(w), List.of(s), config);
  }

  /** Jogadores sem grupo, ordenados por skill, pegos em posições espaçadas do ranking. */
  List<Player> sample(Team team) {
    List<Player> free = team.players().stream()
        .filter(p -> !p.grouped())
        .sorted(Comparator.comparingDouble(Player::effectiveSkill))
        .toList();
    int k = settings.balancerSampleSize();
    if (free.size() <= k) return free;
    if (k == 1) return List.of(free.get(free.size() / 2));

    List<Player> out = new ArrayList<>(k);
    int last = -1;
    for (int i = 0; i < k; i++) {
      int idx = (int) Math.round(i * (free.size() - 1) / (double) (k - 1));
      if (idx == last) continue;
      out.add(free.get(idx));
      last = idx;
    }
    return out;
  }

  private double roleDeviation(int handlers) {
    return Math.abs(handlers - settings.handlerTarget());
  }

  // -------------------------
  // Helpers
  // -------------------------

  private static TeamAssignment applySwap(TeamAssignment state, Candidate c) {
    List<Team> teams = new ArrayList<>(state.teams().size());
    for (Team t : state.teams()) {
      if (t.id().equals(c.weak.id())) {
        teams.add(replace(t, c.out.id(), c.in.withTeamId(t.id())));
      } else if (t.id().equals(c.strong.id())) {
        teams.add(replace(t, c.in.id(), c.out.withTeamId(t.id())));
      } else {
        teams.add(t);
      }
    }
    return state.withTeams(teams);
  }

  private static Team replace(Team t, String outId, Player in) {
    List<Player> out = new ArrayList<>(t.size());
    for (Player p : t.players()) out.add(p.id().equals(outId) ? in : p);
    return t.withPlayers(out);
  }

  private static List<Team> nonEmptySorted(List<Team> teams) {
    return teams.stream()
        .filter(t -> t.size() > 0)
        .sorted(Comparator.comparingDouble(Team::averageSkill))
        .toList();
  }

  static double spread(List<Team> sorted) {
    if (sorted.size() < 2) return 0;
    return sorted.get(sorted.size() - 1).averageSkill() - sorted.get(0).averageSkill();
  }

  /** Vizinhos (i, i+1) e o par extremo (0, n-1) quando não é vizinho. */
  private static List<int[]> pairs(int n) {
    List<int[]> out = new ArrayList<>();
    for (int i = 0; i + 1 < n; i++) out.add(new int[] {i, i + 1});
    if (n > 2) out.add(new int[] {0, n - 1});
    return out;
  }
}
