package br.teambuilder.engine;

import java.util.List;
import java.util.Objects;

/**
 * Jogador do elenco (snapshot imutável).
 *
 * - teammateRequests: ordem importa (índice 0 = must-have, resto = nice-to-have)
 * - execSkillRating: quando presente, substitui skillRating (skill efetiva)
 * - teamId/groupId: carimbados pelo pipeline em cópias novas (withTeamId/withGroupId)
 */
public record Player(
    String id,
    String name,
    Gender gender,
    double skillRating,
    Double execSkillRating,
    List<String> teammateRequests,
    List<String> avoidRequests,
    String teamId,
    String groupId,
    boolean handler,
    List<UnfulfilledRequest> unfulfilledRequests) {

  public Player {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) throw new IllegalArgumentException("id vazio");
    name = name == null ? "" : name.trim();
    gender = gender == null ? Gender.OTHER : gender;
    teammateRequests = cleanNames(teammateRequests);
    avoidRequests = cleanNames(avoidRequests);
    unfulfilledRequests = unfulfilledRequests == null ? List.of() : List.copyOf(unfulfilledRequests);
  }

  public static Player of(String id, String name, Gender gender, double skillRating) {
    return new Player(id, name, gender, skillRating, null, List.of(), List.of(), null, null, false, List.of());
  }

  public double effectiveSkill() {
    return execSkillRating != null ? execSkillRating : skillRating;
  }

  public boolean grouped() {
    return groupId != null;
  }

  // -------------------------
  // Cópias
  // -------------------------

  public Player withRequests(String... names) {
    return new Player(id, name, gender, skillRating, execSkillRating, List.of(names), avoidRequests,
        teamId, groupId, handler, unfulfilledRequests);
  }

  public Player withAvoids(String... names) {
    return new Player(id, name, gender, skillRating, execSkillRating, teammateRequests, List.of(names),
        teamId, groupId, handler, unfulfilledRequests);
  }

  public Player withExecSkill(Double exec) {
    return new Player(id, name, gender, skillRating, exec, teammateRequests, avoidRequests,
        teamId, groupId, handler, unfulfilledRequests);
  }

  public Player withHandler(boolean isHandler) {
    return new Player(id, name, gender, skillRating, execSkillRating, teammateRequests, avoidRequests,
        teamId, groupId, isHandler, unfulfilledRequests);
  }

  public Player withTeamId(String newTeamId) {
    if (Objects.equals(teamId, newTeamId)) return this;
    return new Player(id, name, gender, skillRating, execSkillRating, teammateRequests, avoidRequests,
        newTeamId, groupId, handler, unfulfilledRequests);
  }

  public Player withGroupId(String newGroupId) {
    if (Objects.equals(groupId, newGroupId)) return this;
    return new Player(id, name, gender, skillRating, execSkillRating, teammateRequests, avoidRequests,
        teamId, newGroupId, handler, unfulfilledRequests);
  }

  public Player withUnfulfilled(List<UnfulfilledRequest> list) {
    return new Player(id, name, gender, skillRating, execSkillRating, teammateRequests, avoidRequests,
        teamId, groupId, handler, list);
  }

  private static List<String> cleanNames(List<String> raw) {
    if (raw == null || raw.isEmpty()) return List.of();
    return raw.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
