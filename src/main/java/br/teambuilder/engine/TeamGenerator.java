package br.teambuilder.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pipeline completo:
 *   formação de grupos -> alocação -> balanceamento (só BALANCED) -> estatísticas
 *
 * Uma chamada, um resultado; nada de estado compartilhado entre chamadas além do cache
 * de nomes do NameResolver. Pré-condição: config.quotasFeasible() (checado por quem chama).
 */
public final class TeamGenerator {

  private static final Logger log = LoggerFactory.getLogger(TeamGenerator.class);

  private final NameResolver resolver;
  private final GroupFormation formation;
  private final ConstraintAssigner assigner;
  private final SkillBalancer balancer;
  private final StatsCollector stats;

  public TeamGenerator() {
    this(EngineSettings.defaults(), new Random());
  }

  public TeamGenerator(EngineSettings settings, Random random) {
    this(new NameResolver(settings), settings, random);
  }

  public TeamGenerator(NameResolver resolver, EngineSettings settings, Random random) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.formation = new GroupFormation(resolver);
    this.assigner = new ConstraintAssigner(random);
    this.balancer = new SkillBalancer(settings);
    this.stats = new StatsCollector(resolver);
  }

  public NameResolver resolver() {
    return resolver;
  }

  public ConstraintAssigner assigner() {
    return assigner;
  }

  public GenerationResult generate(List<Player> players, LeagueConfig config, List<PlayerGroup> customGroups,
      GenerationMode mode) {
    Objects.requireNonNull(players, "players");
    Objects.requireNonNull(config, "config");
    GenerationMode m = mode == null ? GenerationMode.BALANCED : mode;
    long t0 = System.nanoTime();

    GroupFormationResult groups = formation.processMutualRequests(players, customGroups);
    List<PlayerGroup> custom = restamp(customGroups, groups.players());

    TeamAssignment assignment = assigner.assign(groups.players(), config, custom, groups.groups(), groups.avoids(), m);

    SkillBalancer.BalanceReport report = null;
    if (m == GenerationMode.BALANCED) {
      report = balancer.balance(assignment);
      assignment = report.assignment();
    }

    long ms = (System.nanoTime() - t0) / 1_000_000L;
    int swaps = report == null ? 0 : report.swapCount();
    GenerationStats s = stats.collect(assignment, (int) groups.avoidVsRequestCount(), swaps, ms);

    log.info("Geração {}: {} jogadores, {} times, {} sem time, {} grupos, {} trocas, {} ms",
        m, s.totalPlayers(), assignment.teams().size(), s.unassignedPlayers(), assignment.groups().size(), swaps, ms);
    if (s.avoidViolations() > 0) {
      log.warn("Composição final tem {} violações de avoid", s.avoidViolations());
    }
    return new GenerationResult(m, assignment, groups, report, s);
  }

  public GenerationResult generate(List<Player> players, LeagueConfig config) {
    return generate(players, config, List.of(), GenerationMode.BALANCED);
  }

  /** Recalcula estatísticas depois de movimentações manuais. */
  public GenerationStats restat(TeamAssignment state, GenerationResult previous) {
    int conflicts = previous == null ? 0 : previous.stats().conflictsDetected();
    int swaps = previous == null ? 0 : previous.stats().swapsApplied();
    long ms = previous == null ? 0 : previous.stats().durationMs();
    return stats.collect(state, conflicts, swaps, ms);
  }

  /** Grupos customizados com os Player já carimbados (groupId, pedidos não atendidos). */
  private static List<PlayerGroup> restamp(List<PlayerGroup> customGroups, List<Player> stamped) {
    if (customGroups == null || customGroups.isEmpty()) return List.of();
    Map<String, Player> byId = stamped.stream()
        .collect(Collectors.toMap(Player::id, Function.identity(), (a, b) -> a));
    List<PlayerGroup> out = new ArrayList<>(customGroups.size());
    for (PlayerGroup g : customGroups) {
      List<Player> members = new ArrayList<>();
      for (String pid : g.playerIds()) {
        Player p = byId.get(pid);
        if (p != null) members.add(p);
      }
      out.add(new PlayerGroup(g.id(), g.label(), g.color(), g.playerIds(), members));
    }
    return out;
  }
}
