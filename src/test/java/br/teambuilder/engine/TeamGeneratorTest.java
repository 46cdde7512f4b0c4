package br.teambuilder.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class TeamGeneratorTest {

  private static final String[] NAMES = {
      "Alice", "Bruno", "Carla", "Diego", "Elisa", "Fabio",
      "Gisele", "Hugo", "Iris", "Joaquim", "Karen", "Lucas"
  };

  private static List<Player> league() {
    List<Player> out = new ArrayList<>();
    for (int i = 0; i < NAMES.length; i++) {
      Gender g = i % 2 == 0 ? Gender.F : Gender.M;
      out.add(Player.of("p" + i, NAMES[i], g, 2 + (i * 7) % 9));
    }
    // Alice <-> Bruno, Carla <-> Diego <-> Elisa (cadeia), Hugo evita Iris, Karen pede Lucas (mão única)
    out.set(0, out.get(0).withRequests("Bruno"));
    out.set(1, out.get(1).withRequests("Alice"));
    out.set(2, out.get(2).withRequests("Diego"));
    out.set(3, out.get(3).withRequests("Carla", "Elisa"));
    out.set(4, out.get(4).withRequests("Diego"));
    out.set(7, out.get(7).withAvoids("Iris").withHandler(true));
    out.set(10, out.get(10).withRequests("Lucas"));
    out.set(11, out.get(11).withHandler(true));
    return out;
  }

  private static void assertInvariants(GenerationResult r, LeagueConfig cfg) {
    TeamAssignment a = r.assignment();
    for (Team t : r.teams()) assertTrue(t.size() <= cfg.maxTeamSize(), t.toString());
    assertEquals(0, StatsCollector.avoidViolations(a));

    for (PlayerGroup g : r.groups()) {
      Team first = a.teamOf(g.playerIds().get(0));
      for (String pid : g.playerIds()) {
        Team t = a.teamOf(pid);
        assertEquals(first == null ? null : first.id(), t == null ? null : t.id(), "grupo separado: " + g.id());
      }
    }
    assertEquals(r.stats().totalPlayers(), a.assignedCount() + r.unassigned().size());
  }

  @Test
  void balancedPipeline_keepsAllHardConstraints() {
    LeagueConfig cfg = LeagueConfig.of(4, 1, 1, 3);

    GenerationResult r = new TeamGenerator(EngineSettings.defaults(), new Random(5))
        .generate(league(), cfg, List.of(), GenerationMode.BALANCED);

    assertEquals(3, r.teams().size());
    assertEquals(2, r.groups().size());
    assertNotNull(r.balance());
    assertEquals(12, r.stats().totalPlayers());
    assertEquals(0, r.stats().groupsSplit());
    assertEquals(r.balance().swapCount(), r.stats().swapsApplied());
    assertInvariants(r, cfg);

    Team withHugo = r.assignment().teamOf("p7");
    Team withIris = r.assignment().teamOf("p8");
    assertFalse(withHugo != null && withIris != null && withHugo.id().equals(withIris.id()));
  }

  @Test
  void randomPipeline_isReproducibleWithSeed() {
    LeagueConfig cfg = LeagueConfig.of(4, 0, 0, 3);

    GenerationResult r1 = new TeamGenerator(EngineSettings.defaults(), new Random(11))
        .generate(league(), cfg, List.of(), GenerationMode.RANDOM);
    GenerationResult r2 = new TeamGenerator(EngineSettings.defaults(), new Random(11))
        .generate(league(), cfg, List.of(), GenerationMode.RANDOM);

    assertEquals(r1.assignment().assignments(), r2.assignment().assignments());
    assertNull(r1.balance(), "modo aleatório não balanceia");
    assertInvariants(r1, cfg);
  }

  @Test
  void manualPipeline_leavesEveryoneUnassigned() {
    GenerationResult r = new TeamGenerator().generate(league(), LeagueConfig.of(4, 0, 0, 3), List.of(),
        GenerationMode.MANUAL);

    assertEquals(3, r.teams().size());
    assertEquals(12, r.unassigned().size());
    assertEquals(2, r.groups().size(), "grupos continuam formados para movimentação manual");
  }

  @Test
  void manualMoves_thenRestat() {
    TeamGenerator generator = new TeamGenerator();
    GenerationResult r = generator.generate(league(), LeagueConfig.of(4, 0, 0, 3), List.of(), GenerationMode.MANUAL);
    PlayerGroup ab = r.groups().get(0);

    MoveResult moved = generator.assigner().moveGroup(r.assignment(), ab.id(), "team-1");
    assertTrue(moved.accepted());
    MoveResult split = generator.assigner().movePlayer(moved.assignment(), "p0", "team-2", false);
    assertEquals(MoveResult.GROUP_SPLIT, split.reason());

    GenerationStats s = generator.restat(moved.assignment(), r);
    assertEquals(2, s.assignedPlayers());
    assertEquals(2, s.mustHaveHonored());
    assertEquals(r.stats().conflictsDetected(), s.conflictsDetected());
  }

  @Test
  void customGroups_arePlacedTogether() {
    List<Player> roster = league();
    PlayerGroup custom = new PlayerGroup("custom-1", "A", GroupPalette.color(0),
        List.of("p5", "p6", "p9"), List.of());

    GenerationResult r = new TeamGenerator(EngineSettings.defaults(), new Random(2))
        .generate(roster, LeagueConfig.of(4, 0, 0, 3), List.of(custom), GenerationMode.BALANCED);

    Team t = r.assignment().teamOf("p5");
    assertNotNull(t);
    assertEquals(t, r.assignment().teamOf("p6"));
    assertEquals(t, r.assignment().teamOf("p9"));
    assertEquals("custom-1", r.assignment().player("p5").groupId());
    assertEquals("custom-1", r.groups().get(0).id());
  }

  @Test
  void customGroupIdLikeGenerated_keepsGroupIdsUnique() {
    List<Player> roster = List.of(
        Player.of("a", "Alice", Gender.F, 5),
        Player.of("b", "Bruno", Gender.M, 5),
        Player.of("c", "Carla", Gender.F, 5).withRequests("Diego"),
        Player.of("d", "Diego", Gender.M, 5).withRequests("Carla"));
    PlayerGroup custom = new PlayerGroup("group-1", "A", GroupPalette.color(0), List.of("a", "b"), List.of());
    TeamGenerator generator = new TeamGenerator(EngineSettings.defaults(), new Random(1));

    GenerationResult r = generator.generate(roster, LeagueConfig.of(4, 0, 0, 2), List.of(custom), GenerationMode.MANUAL);

    List<String> ids = r.groups().stream().map(PlayerGroup::id).toList();
    assertEquals(List.of("group-1", "group-2"), ids);

    MoveResult moved = generator.assigner().moveGroup(r.assignment(), "group-2", "team-2");
    assertTrue(moved.accepted());
    assertEquals("team-2", moved.assignment().teamOf("c").id());
    assertEquals("team-2", moved.assignment().teamOf("d").id());
    assertNull(moved.assignment().teamOf("a"));
  }

  @Test
  void noPlayers_yieldsEmptyResult() {
    GenerationResult r = new TeamGenerator().generate(List.of(), LeagueConfig.defaults());

    assertTrue(r.teams().isEmpty());
    assertTrue(r.unassigned().isEmpty());
    assertEquals(0, r.stats().totalPlayers());
  }

  @Test
  void zeroTargetTeams_leavesEveryoneUnassigned() {
    GenerationResult r = new TeamGenerator().generate(league(), LeagueConfig.of(4, 0, 0, 0));

    assertTrue(r.teams().isEmpty());
    assertEquals(12, r.unassigned().size());
    assertEquals(0, r.stats().assignedPlayers());
  }

  @Test
  void teamCount_defaultsToCeilOfRosterOverCapacity() {
    GenerationResult r = new TeamGenerator().generate(league(), LeagueConfig.of(5, 0, 0, null));

    assertEquals(3, r.teams().size());
    assertTrue(r.unassigned().isEmpty());
  }
}
