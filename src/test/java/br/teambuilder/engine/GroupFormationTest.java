package br.teambuilder.engine;

import com.google.gson.JsonArray;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GroupFormationTest {

  private final GroupFormation formation = new GroupFormation(new NameResolver());

  private static Player p(String id, String name) {
    return Player.of(id, name, Gender.M, 5);
  }

  @Test
  void mutualPair_formsGroup_oneWayRequestDoesNot() {
    List<Player> roster = List.of(
        p("a", "Alice").withRequests("Bruno"),
        p("b", "Bruno").withRequests("Alice"),
        p("c", "Carla").withRequests("Diego"),
        p("d", "Diego"));

    GroupFormationResult r = formation.processMutualRequests(roster);

    assertEquals(1, r.groups().size());
    PlayerGroup g = r.groups().get(0);
    assertEquals(List.of("a", "b"), g.playerIds());
    assertEquals("group-0", g.id());
    assertEquals("A", g.label());
    assertEquals(GroupPalette.color(0), g.color());

    assertEquals("group-0", r.players().get(0).groupId());
    assertNull(r.players().get(2).groupId(), "pedido de mão única não pode agrupar");
    assertNull(r.players().get(3).groupId());

    List<UnfulfilledRequest> carla = r.players().get(2).unfulfilledRequests();
    assertEquals(1, carla.size());
    assertEquals(UnfulfilledRequest.Reason.NON_RECIPROCAL, carla.get(0).reason());
    assertEquals(RequestPriority.MUST_HAVE, carla.get(0).priority());

    assertTrue(r.conflicts().stream().anyMatch(c ->
        c.type() == RequestConflict.Type.ONE_WAY_REQUEST && c.requesterId().equals("c")));
  }

  @Test
  void chainOfFive_isCappedAtFour_andRecordsNearMiss() {
    List<Player> roster = List.of(
        p("a", "Alice").withRequests("Bruno"),
        p("b", "Bruno").withRequests("Alice", "Carla"),
        p("c", "Carla").withRequests("Bruno", "Diego"),
        p("d", "Diego").withRequests("Carla", "Elisa"),
        p("e", "Elisa").withRequests("Diego"));

    GroupFormationResult r = formation.processMutualRequests(roster);

    assertEquals(1, r.groups().size());
    assertEquals(List.of("a", "b", "c", "d"), r.groups().get(0).playerIds());
    for (PlayerGroup g : r.groups()) {
      assertTrue(g.size() > 1 && g.size() <= GroupFormation.MAX_GROUP_SIZE);
    }

    assertEquals(1, r.nearMisses().size());
    NearMiss nm = r.nearMisses().get(0);
    assertEquals(List.of("e"), nm.overflowIds());
    assertEquals(NearMiss.GROUP_TOO_LARGE, nm.reason());

    Player elisa = r.players().get(4);
    assertNull(elisa.groupId());
    assertEquals(UnfulfilledRequest.Reason.GROUP_FULL, elisa.unfulfilledRequests().get(0).reason());
  }

  @Test
  void avoidOverridesMutualRequest() {
    List<Player> roster = List.of(
        p("a", "Alice").withRequests("Bruno").withAvoids("Bruno"),
        p("b", "Bruno").withRequests("Alice"));

    GroupFormationResult r = formation.processMutualRequests(roster);

    assertTrue(r.groups().isEmpty());
    assertEquals(1, r.avoidVsRequestCount());
    assertTrue(r.avoids().conflict("a", "b"));
    assertEquals(UnfulfilledRequest.Reason.CONFLICT, r.players().get(0).unfulfilledRequests().get(0).reason());
  }

  @Test
  void avoidInsideComponent_keepsConflictingPlayerOut() {
    // a-b-c todos mútuos, mas c evita a
    List<Player> roster = List.of(
        p("a", "Alice").withRequests("Bruno"),
        p("b", "Bruno").withRequests("Alice", "Carla"),
        p("c", "Carla").withRequests("Bruno").withAvoids("Alice"));

    GroupFormationResult r = formation.processMutualRequests(roster);

    assertEquals(1, r.groups().size());
    assertEquals(List.of("a", "b"), r.groups().get(0).playerIds());
    assertNull(r.players().get(2).groupId());

    // barrado pela Alice, não por falta de vaga
    assertEquals(UnfulfilledRequest.Reason.CONFLICT, r.players().get(2).unfulfilledRequests().get(0).reason());
    List<UnfulfilledRequest> bruno = r.players().get(1).unfulfilledRequests();
    assertEquals(1, bruno.size());
    assertEquals("Carla", bruno.get(0).name());
    assertEquals(UnfulfilledRequest.Reason.CONFLICT, bruno.get(0).reason());
  }

  @Test
  void mediumConfidenceAvoid_doesNotBlockGroup_andIsSurfaced() {
    List<Player> roster = List.of(
        p("x", "Xavier").withRequests("Mike Sanders").withAvoids("Mike Smith"),
        p("s", "Mike Sanders").withRequests("Xavier"));

    GroupFormationResult r = formation.processMutualRequests(roster);

    assertEquals(1, r.groups().size());
    assertEquals(List.of("x", "s"), r.groups().get(0).playerIds());
    assertTrue(r.conflicts().isEmpty());

    JsonArray review = JsonUtil.getArray(RosterJson.render(r, null), "warnings", "avoidNeedsReview");
    assertEquals(1, review.size());
    assertEquals("Mike Smith", review.get(0).getAsJsonObject().get("request").getAsString());
    assertEquals("s", review.get(0).getAsJsonObject().get("candidateId").getAsString());
  }

  @Test
  void unresolvedRequest_isReportedNotFound() {
    List<Player> roster = List.of(p("a", "Alice").withRequests("Zzyzx Qwop"), p("b", "Bruno"));

    GroupFormationResult r = formation.processMutualRequests(roster);

    assertEquals(1, r.notFound().size());
    assertEquals(UnfulfilledRequest.Reason.NOT_FOUND, r.players().get(0).unfulfilledRequests().get(0).reason());
  }

  @Test
  void customGroupMembers_areExcluded_andLabelsContinueAfterThem() {
    List<Player> roster = List.of(
        p("a", "Alice").withRequests("Bruno"),
        p("b", "Bruno").withRequests("Alice"),
        p("c", "Carla").withRequests("Diego"),
        p("d", "Diego").withRequests("Carla"));
    PlayerGroup custom = new PlayerGroup("custom-1", "A", GroupPalette.color(0), List.of("a", "b"), List.of());

    GroupFormationResult r = formation.processMutualRequests(roster, List.of(custom));

    assertEquals(1, r.groups().size());
    PlayerGroup formed = r.groups().get(0);
    assertEquals(List.of("c", "d"), formed.playerIds());
    assertEquals("group-1", formed.id());
    assertEquals("B", formed.label());

    assertEquals("custom-1", r.players().get(0).groupId());
    assertEquals("custom-1", r.players().get(1).groupId());
    assertTrue(r.players().get(0).unfulfilledRequests().isEmpty());
  }

  @Test
  void formedGroupIds_skipIdsAlreadyTakenByCustomGroups() {
    List<Player> roster = List.of(
        p("a", "Alice"),
        p("b", "Bruno"),
        p("c", "Carla").withRequests("Diego"),
        p("d", "Diego").withRequests("Carla"));
    PlayerGroup custom = new PlayerGroup("group-1", "A", GroupPalette.color(0), List.of("a", "b"), List.of());

    GroupFormationResult r = formation.processMutualRequests(roster, List.of(custom));

    assertEquals(1, r.groups().size());
    PlayerGroup formed = r.groups().get(0);
    assertEquals("group-2", formed.id());
    assertEquals("C", formed.label());
    assertEquals("group-1", r.players().get(0).groupId());
    assertEquals("group-2", r.players().get(2).groupId());
    assertEquals("group-2", r.players().get(3).groupId());
  }

  @Test
  void validateGroupsForGeneration_flagsOversizedAndFullGroups() {
    PlayerGroup big = new PlayerGroup("g1", "A", null, List.of("1", "2", "3", "4", "5"), List.of());
    PlayerGroup full = new PlayerGroup("g2", "B", null, List.of("6", "7", "8", "9"), List.of());
    PlayerGroup ok = new PlayerGroup("g3", "C", null, List.of("10", "11"), List.of());

    GroupValidation v = GroupFormation.validateGroupsForGeneration(List.of(big, full, ok), 4);

    assertFalse(v.ok());
    assertEquals(1, v.errors().size());
    assertTrue(v.errors().get(0).contains("A"));
    assertEquals(1, v.warnings().size());
    assertTrue(GroupFormation.validateGroupsForGeneration(List.of(ok), 4).ok());
  }

  @Test
  void groupLookups() {
    Player a = p("a", "Alice");
    Player b = p("b", "Bruno");
    List<PlayerGroup> groups = List.of(new PlayerGroup("g", "A", null, List.of("a", "b"), List.of(a, b)));

    assertEquals("g", PlayerGroup.groupOf(groups, "b").id());
    assertNull(PlayerGroup.groupOf(groups, "z"));
    assertEquals(List.of(b), PlayerGroup.groupmates(groups, "a"));
    assertTrue(PlayerGroup.inSameGroup(groups, "a", "b"));
    assertFalse(PlayerGroup.inSameGroup(groups, "a", "z"));
  }
}
