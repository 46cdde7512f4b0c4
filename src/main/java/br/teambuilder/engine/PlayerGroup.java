package br.teambuilder.engine;

import java.util.List;
import java.util.Objects;

/**
 * Grupo de afinidade: membros vão juntos para o mesmo time ou ficam todos sem time.
 * Grupos formados automaticamente têm 2..4 membros; grupos customizados vêm do chamador.
 */
public record PlayerGroup(String id, String label, String color, List<String> playerIds, List<Player> players) {

  public PlayerGroup {
    Objects.requireNonNull(id, "id");
    playerIds = playerIds == null ? List.of() : List.copyOf(playerIds);
    players = players == null ? List.of() : List.copyOf(players);
  }

  public int size() {
    return playerIds.size();
  }

  public boolean contains(String playerId) {
    return playerIds.contains(playerId);
  }

  // -------------------------
  // Lookups sobre uma lista de grupos
  // -------------------------

  public static PlayerGroup groupOf(List<PlayerGroup> groups, String playerId) {
    if (groups == null || playerId == null) return null;
    for (PlayerGroup g : groups) {
      if (g.contains(playerId)) return g;
    }
    return null;
  }

  public static List<Player> groupmates(List<PlayerGroup> groups, String playerId) {
    PlayerGroup g = groupOf(groups, playerId);
    if (g == null) return List.of();
    return g.players().stream().filter(p -> !p.id().equals(playerId)).toList();
  }

  public static boolean inSameGroup(List<PlayerGroup> groups, String playerId1, String playerId2) {
    PlayerGroup g1 = groupOf(groups, playerId1);
    return g1 != null && g1.contains(playerId2);
  }
}
