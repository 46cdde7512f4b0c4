package br.teambuilder.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SkillBalancerTest {

  private final SkillBalancer balancer = new SkillBalancer();

  private static Player p(String id, Gender g, double skill) {
    return Player.of(id, "Player " + id, g, skill);
  }

  private static TeamAssignment state(LeagueConfig cfg, AvoidIndex avoids, List<Player> t1, List<Player> t2) {
    List<Team> teams = List.of(
        new Team("team-1", "Team 1", t1.stream().map(x -> x.withTeamId("team-1")).toList()),
        new Team("team-2", "Team 2", t2.stream().map(x -> x.withTeamId("team-2")).toList()));
    return new TeamAssignment(teams, List.of(), List.of(), cfg, avoids);
  }

  @Test
  void singleSwap_closesTheGap() {
    TeamAssignment s = state(LeagueConfig.of(4, 0, 0, 2), AvoidIndex.empty(),
        List.of(p("a", Gender.M, 9), p("b", Gender.M, 9)),
        List.of(p("c", Gender.M, 1), p("d", Gender.M, 1)));

    SkillBalancer.BalanceReport r = balancer.balance(s);

    assertEquals(1, r.swapCount());
    assertEquals(1, r.passes());
    assertTrue(r.finalSpread() < 0.5, "spread final: " + r.finalSpread());
    for (Team t : r.assignment().teams()) {
      assertEquals(2, t.size());
      assertEquals(5.0, t.averageSkill(), 1e-9);
      t.players().forEach(x -> assertEquals(t.id(), x.teamId()));
    }
  }

  @Test
  void execSkill_overridesBaseSkill() {
    TeamAssignment s = state(LeagueConfig.of(4, 0, 0, 2), AvoidIndex.empty(),
        List.of(p("a", Gender.M, 1).withExecSkill(9.0), p("b", Gender.M, 1).withExecSkill(9.0)),
        List.of(p("c", Gender.M, 9).withExecSkill(1.0), p("d", Gender.M, 9).withExecSkill(1.0)));

    SkillBalancer.BalanceReport r = balancer.balance(s);

    assertEquals(1, r.swapCount());
    assertEquals(5.0, r.assignment().team("team-1").averageSkill(), 1e-9);
  }

  @Test
  void smallSpread_stopsBeforeFirstPass() {
    TeamAssignment s = state(LeagueConfig.of(4, 0, 0, 2), AvoidIndex.empty(),
        List.of(p("a", Gender.M, 5), p("b", Gender.M, 5.4)),
        List.of(p("c", Gender.M, 5), p("d", Gender.M, 5)));

    SkillBalancer.BalanceReport r = balancer.balance(s);

    assertEquals(0, r.passes());
    assertEquals(0, r.swapCount());
  }

  @Test
  void groupedPlayers_areNeverSwapped() {
    TeamAssignment s = state(LeagueConfig.of(4, 0, 0, 2), AvoidIndex.empty(),
        List.of(p("a", Gender.M, 9).withGroupId("g"), p("b", Gender.M, 9).withGroupId("g")),
        List.of(p("c", Gender.M, 1), p("d", Gender.M, 1)));

    SkillBalancer.BalanceReport r = balancer.balance(s);

    assertEquals(0, r.swapCount());
    assertTrue(r.assignment().team("team-1").contains("a"));
    assertTrue(r.assignment().team("team-1").contains("b"));
  }

  @Test
  void swapThatCreatesAvoidConflict_isRejected() {
    List<Player> roster = List.of(
        p("a", Gender.M, 9).withAvoids("Player c", "Player d"),
        p("b", Gender.M, 9).withAvoids("Player c", "Player d"),
        p("c", Gender.M, 1),
        p("d", Gender.M, 1));
    AvoidIndex avoids = AvoidIndex.build(roster, new NameResolver());

    TeamAssignment s = state(LeagueConfig.of(4, 0, 0, 2), avoids, roster.subList(0, 2), roster.subList(2, 4));
    SkillBalancer.BalanceReport r = balancer.balance(s);

    assertEquals(0, r.swapCount());
    assertEquals(0, StatsCollector.avoidViolations(r.assignment()));
  }

  @Test
  void swapThatBreaksGenderMinimum_isRejected() {
    TeamAssignment s = state(LeagueConfig.of(2, 1, 0, 2), AvoidIndex.empty(),
        List.of(p("f", Gender.F, 9), p("m", Gender.M, 9)),
        List.of(p("c", Gender.F, 1), p("d", Gender.M, 1)));

    SkillBalancer.BalanceReport r = balancer.balance(s);

    assertTrue(r.swapCount() >= 1);
    for (Team t : r.assignment().teams()) assertEquals(1, t.count(Gender.F), t.toString());
  }

  @Test
  void passCap_isHonored() {
    EngineSettings oneShot = new EngineSettings(0.6, 0.3, 0.8, 1, 0.5, 4, 0.01, 2, 0.25);
    TeamAssignment s = state(LeagueConfig.of(6, 0, 0, 2), AvoidIndex.empty(),
        List.of(p("a", Gender.M, 9), p("b", Gender.M, 9), p("c", Gender.M, 9)),
        List.of(p("d", Gender.M, 1), p("e", Gender.M, 1), p("f", Gender.M, 1)));

    SkillBalancer.BalanceReport r = new SkillBalancer(oneShot).balance(s);

    assertEquals(1, r.passes());
    assertEquals(1, r.swapCount());
  }

  @Test
  void sample_isSpreadAcrossTheRanking() {
    Team t = new Team("team-1", "Team 1", List.of(
        p("a", Gender.M, 1), p("b", Gender.M, 2), p("c", Gender.M, 3), p("d", Gender.M, 4),
        p("e", Gender.M, 5), p("f", Gender.M, 6), p("g", Gender.M, 7)));

    List<Player> sample = balancer.sample(t);

    assertEquals(4, sample.size());
    assertEquals("a", sample.get(0).id());
    assertEquals("g", sample.get(3).id());
  }
}
