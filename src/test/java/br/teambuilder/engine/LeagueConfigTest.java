package br.teambuilder.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LeagueConfigTest {

  @Test
  void teamCount_usesTargetWhenPresent() {
    assertEquals(3, LeagueConfig.of(4, 0, 0, 3).teamCount(100));
    assertEquals(0, LeagueConfig.of(4, 0, 0, 0).teamCount(10));
    assertEquals(0, LeagueConfig.of(4, 0, 0, -2).teamCount(10));
  }

  @Test
  void teamCount_withoutTarget_isCeilOfRosterOverCapacity() {
    assertEquals(3, LeagueConfig.of(4, 0, 0, null).teamCount(9));
    assertEquals(2, LeagueConfig.of(4, 0, 0, null).teamCount(8));
    assertEquals(0, LeagueConfig.of(4, 0, 0, null).teamCount(0));
  }

  @Test
  void validate_clampsOutOfRangeValues() {
    LeagueConfig v = new LeagueConfig(null, "  " + "x".repeat(80), 1, 20, -1, 99, true).validate();

    assertEquals("default", v.id());
    assertEquals(50, v.name().length());
    assertEquals(2, v.maxTeamSize());
    assertEquals(15, v.minFemales());
    assertEquals(0, v.minMales());
    assertEquals(50, v.targetTeams());

    assertEquals(LeagueConfig.DEFAULT_MAX_TEAM_SIZE, LeagueConfig.of(0, 0, 0, null).validate().maxTeamSize());
    assertEquals(0, LeagueConfig.of(4, 0, 0, 0).validate().targetTeams());
  }

  @Test
  void quotasFeasible() {
    assertTrue(LeagueConfig.of(4, 2, 2, null).quotasFeasible());
    assertFalse(LeagueConfig.of(4, 3, 2, null).quotasFeasible());
  }
}
