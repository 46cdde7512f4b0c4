package br.teambuilder.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Aloca unidades (grupo inteiro ou jogador avulso) em N slots de time respeitando:
 *  - capacidade (maxTeamSize)
 *  - cota de gênero alcançável
 *  - avoid simétrico entre qualquer membro da unidade e qualquer jogador do time
 *
 * Uma unidade nunca é dividida: ou entra inteira num time, ou vai inteira para "sem time".
 *
 * Modos:
 *  - BALANCED: mais restritos primeiro (soma de avoids); prefere o time com menos gente e,
 *    no empate, o que deixa a média mais perto da média geral do elenco
 *  - RANDOM: mesma checagem, ordem das unidades e dos times embaralhada (Random injetado)
 *  - MANUAL: cria os times vazios e não aloca ninguém
 */
public final class ConstraintAssigner {

  private static final Logger log = LoggerFactory.getLogger(ConstraintAssigner.class);

  private static final double SKILL_EPS = 1e-9;

  /** Unidade de alocação. priority: 1 = grupo customizado, 2 = grupo mútuo, 3 = avulso. */
  public record Unit(List<Player> members, int priority) {

    public Unit {
      members = List.copyOf(members);
    }

    public int size() {
      return members.size();
    }

    public int avoidCount() {
      int n = 0;
      for (Player p : members) n += p.avoidRequests().size();
      return n;
    }

    double totalSkill() {
      double s = 0;
      for (Player p : members) s += p.effectiveSkill();
      return s;
    }
  }

  private final Random random;

  public ConstraintAssigner() {
    this(new Random());
  }

  public ConstraintAssigner(Random random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  // -------------------------
  // Unidades
  // -------------------------

  /**
   * 1) grupos customizados, 2) grupos mútuos que não encostam em nenhum customizado,
   * 3) todo o resto como unidade de 1.
   */
  public List<Unit> buildUnits(List<Player> players, List<PlayerGroup> customGroups, List<PlayerGroup> mutualGroups) {
    Map<String, Player> byId = new LinkedHashMap<>();
    for (Player p : players) byId.putIfAbsent(p.id(), p);

    List<Unit> units = new ArrayList<>();
    Set<String> covered = new HashSet<>();

    for (PlayerGroup g : nonNull(customGroups)) {
      List<Player> members = membersOf(g, byId, covered);
      if (members.isEmpty()) continue;
      units.add(new Unit(members, 1));
      members.forEach(p -> covered.add(p.id()));
    }

    for (PlayerGroup g : nonNull(mutualGroups)) {
      boolean overlaps = g.playerIds().stream().anyMatch(covered::contains);
      if (overlaps) continue;
      List<Player> members = membersOf(g, byId, covered);
      if (members.size() < 2) continue;
      units.add(new Unit(members, 2));
      members.forEach(p -> covered.add(p.id()));
    }

    for (Player p : byId.values()) {
      if (!covered.contains(p.id())) units.add(new Unit(List.of(p), 3));
    }
    return units;
  }

  // -------------------------
  // Alocação
  // -------------------------

  public TeamAssignment assign(
      List<Player> players,
      LeagueConfig config,
      List<PlayerGroup> customGroups,
      List<PlayerGroup> mutualGroups,
      AvoidIndex avoids,
      GenerationMode mode) {

    Objects.requireNonNull(players, "players");
    Objects.requireNonNull(config, "config");
    AvoidIndex avoidIndex = avoids == null ? AvoidIndex.empty() : avoids;

    List<PlayerGroup> groups = new ArrayList<>(nonNull(customGroups));
    groups.addAll(nonNull(mutualGroups));

    int teamCount = config.teamCount(players.size());
    List<Team> slots = new ArrayList<>(teamCount);
    for (int i = 0; i < teamCount; i++) slots.add(Team.empty(i));

    if (mode == GenerationMode.MANUAL) {
      List<Player> all = players.stream().map(p -> p.withTeamId(null)).toList();
      log.debug("Modo manual: {} times vazios, {} jogadores sem time", teamCount, all.size());
      return new TeamAssignment(slots, all, groups, config, avoidIndex);
    }

    List<Unit> units = new ArrayList<>(buildUnits(players, customGroups, mutualGroups));
    double rosterMean = meanSkill(players);
    List<Player> unassigned = new ArrayList<>();

    if (mode == GenerationMode.RANDOM) {
      Collections.shuffle(units, random);
    } else {
      // estável: empates mantêm a prioridade (customizado > mútuo > avulso)
      units.sort(Comparator.comparingInt(Unit::avoidCount).reversed());
    }

    for (Unit unit : units) {
      int chosen = mode == GenerationMode.RANDOM
          ? firstFeasibleShuffled(unit, slots, config, avoidIndex)
          : bestFeasible(unit, slots, config, avoidIndex, rosterMean);

      if (chosen < 0) {
        unassigned.addAll(unit.members());
        if (unit.size() > 1) {
          log.warn("Unidade de {} jogadores sem time viável: {}", unit.size(), namesOf(unit.members()));
        } else {
          log.debug("Jogador sem time viável: {}", unit.members().get(0).name());
        }
        continue;
      }
      slots.set(chosen, slots.get(chosen).plus(unit.members()));
    }

    // Materializa: carimba teamId nos jogadores de cada time
    List<Team> teams = new ArrayList<>(slots.size());
    for (Team t : slots) {
      teams.add(t.withPlayers(t.players().stream().map(p -> p.withTeamId(t.id())).toList()));
    }
    List<Player> loose = unassigned.stream().map(p -> p.withTeamId(null)).toList();

    log.debug("Alocação {}: {} times, {} alocados, {} sem time",
        mode, teams.size(), players.size() - loose.size(), loose.size());
    return new TeamAssignment(teams, loose, groups, config, avoidIndex);
  }

  /** Checagem dura: capacidade, cota alcançável, avoid (dentro da unidade e contra o time). */
  static boolean feasible(Unit unit, Team team, LeagueConfig config, AvoidIndex avoids) {
    if (team.size() + unit.size() > config.maxTeamSize()) return false;
    if (!GenderQuota.achievableAfter(team, unit.members(), config)) return false;
    if (avoids.internalConflict(unit.members())) return false;
    for (Player p : unit.members()) {
      if (avoids.conflictsWithAny(p, team.players())) return false;
    }
    return true;
  }

  private static int bestFeasible(Unit unit, List<Team> slots, LeagueConfig config, AvoidIndex avoids, double mean) {
    int best = -1;
    double bestDiff = Double.MAX_VALUE;
    for (int i = 0; i < slots.size(); i++) {
      Team t = slots.get(i);
      if (!feasible(unit, t, config, avoids)) continue;

      double newAvg = (t.totalSkill() + unit.totalSkill()) / (t.size() + unit.size());
      double diff = Math.abs(newAvg - mean);
      if (best < 0
          || t.size() < slots.get(best).size()
          || (t.size() == slots.get(best).size() && diff < bestDiff - SKILL_EPS)) {
        best = i;
        bestDiff = diff;
      }
    }
    return best;
  }

  private int firstFeasibleShuffled(Unit unit, List<Team> slots, LeagueConfig config, AvoidIndex avoids) {
    List<Integer> order = new ArrayList<>(slots.size());
    for (int i = 0; i < slots.size(); i++) order.add(i);
    Collections.shuffle(order, random);
    for (int i : order) {
      if (feasible(unit, slots.get(i), config, avoids)) return i;
    }
    return -1;
  }

  // -------------------------
  // Movimentação manual
  // -------------------------

  /**
   * Move um jogador para targetTeamId (null = sem time).
   * Rejeita: time cheio, avoid no time de destino, e separar um grupo (a menos que force).
   */
  public MoveResult movePlayer(TeamAssignment state, String playerId, String targetTeamId, boolean force) {
    Objects.requireNonNull(state, "state");
    Player player = state.player(playerId);
    if (player == null) throw new IllegalArgumentException("Jogador não encontrado: " + playerId);

    Team target = null;
    if (targetTeamId != null) {
      target = state.team(targetTeamId);
      if (target == null) throw new IllegalArgumentException("Time não encontrado: " + targetTeamId);
    }

    Team source = state.teamOf(playerId);
    if (Objects.equals(source == null ? null : source.id(), targetTeamId)) {
      return new MoveResult(true, MoveResult.NO_CHANGE, state);
    }

    if (target != null) {
      if (target.size() + 1 > state.config().maxTeamSize()) return MoveResult.rejected(MoveResult.TEAM_FULL, state);
      if (state.avoids().conflictsWithAny(player, target.players())) {
        return MoveResult.rejected(MoveResult.AVOID_CONFLICT, state);
      }
    }

    if (!force && wouldSplitGroup(state, player, targetTeamId)) {
      return MoveResult.rejected(MoveResult.GROUP_SPLIT, state);
    }
    if (force && wouldSplitGroup(state, player, targetTeamId)) {
      log.info("Grupo de {} separado manualmente (force)", player.name());
    }

    return MoveResult.ok(apply(state, List.of(player), targetTeamId));
  }

  /** Move todos os membros do grupo juntos (nunca separa). */
  public MoveResult moveGroup(TeamAssignment state, String groupId, String targetTeamId) {
    Objects.requireNonNull(state, "state");
    PlayerGroup group = state.groups().stream().filter(g -> g.id().equals(groupId)).findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Grupo não encontrado: " + groupId));

    List<Player> members = new ArrayList<>();
    for (String pid : group.playerIds()) {
      Player p = state.player(pid);
      if (p != null) members.add(p);
    }

    if (targetTeamId != null) {
      Team target = state.team(targetTeamId);
      if (target == null) throw new IllegalArgumentException("Time não encontrado: " + targetTeamId);

      List<Player> others = target.players().stream().filter(p -> !group.contains(p.id())).toList();
      long arriving = members.stream().filter(p -> !target.contains(p.id())).count();
      if (arriving == 0) return new MoveResult(true, MoveResult.NO_CHANGE, state);
      if (target.size() + arriving > state.config().maxTeamSize()) {
        return MoveResult.rejected(MoveResult.TEAM_FULL, state);
      }
      for (Player p : members) {
        if (state.avoids().conflictsWithAny(p, others)) return MoveResult.rejected(MoveResult.AVOID_CONFLICT, state);
      }
    }

    return MoveResult.ok(apply(state, members, targetTeamId));
  }

  private static boolean wouldSplitGroup(TeamAssignment state, Player player, String targetTeamId) {
    PlayerGroup g = PlayerGroup.groupOf(state.groups(), player.id());
    if (g == null || g.size() < 2) return false;
    for (String pid : g.playerIds()) {
      if (pid.equals(player.id()) || state.player(pid) == null) continue;
      Team t = state.teamOf(pid);
      if (!Objects.equals(t == null ? null : t.id(), targetTeamId)) return true;
    }
    return false;
  }

  private static TeamAssignment apply(TeamAssignment state, List<Player> moving, String targetTeamId) {
    Set<String> ids = new HashSet<>();
    moving.forEach(p -> ids.add(p.id()));

    List<Team> teams = new ArrayList<>(state.teams().size());
    for (Team t : state.teams()) {
      List<Player> kept = t.players().stream().filter(p -> !ids.contains(p.id())).toList();
      if (t.id().equals(targetTeamId)) {
        List<Player> merged = new ArrayList<>(kept);
        moving.forEach(p -> merged.add(p.withTeamId(t.id())));
        teams.add(t.withPlayers(merged));
      } else if (kept.size() != t.size()) {
        teams.add(t.withPlayers(kept));
      } else {
        teams.add(t);
      }
    }

    List<Player> unassigned = new ArrayList<>();
    for (Player p : state.unassigned()) {
      if (!ids.contains(p.id())) unassigned.add(p);
    }
    if (targetTeamId == null) {
      moving.forEach(p -> unassigned.add(p.withTeamId(null)));
    }

    return new TeamAssignment(teams, unassigned, state.groups(), state.config(), state.avoids());
  }

  // -------------------------
  // Helpers
  // -------------------------

  private static List<Player> membersOf(PlayerGroup g, Map<String, Player> byId, Set<String> covered) {
    List<Player> out = new ArrayList<>();
    for (String pid : g.playerIds()) {
      Player p = byId.get(pid);
      if (p != null && !covered.contains(pid) && !out.contains(p)) out.add(p);
    }
    return out;
  }

  private static double meanSkill(List<Player> players) {
    if (players.isEmpty()) return 0;
    double s = 0;
    for (Player p : players) s += p.effectiveSkill();
    return s / players.size();
  }

  private static List<String> namesOf(List<Player> players) {
    return players.stream().map(Player::name).toList();
  }

  private static <T> List<T> nonNull(List<T> l) {
    return l == null ? List.of() : l;
  }
}
