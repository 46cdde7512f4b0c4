package br.teambuilder.engine;

import java.util.List;

/**
 * Saída da formação de grupos.
 *
 * players: elenco na ordem de entrada, com groupId e unfulfilledRequests preenchidos.
 * groups: grupos formados a partir de pedidos mútuos (sem os customizados).
 */
public record GroupFormationResult(
    List<Player> players,
    List<PlayerGroup> groups,
    List<RequestResolution> resolutions,
    List<RequestConflict> conflicts,
    List<NearMiss> nearMisses,
    AvoidIndex avoids) {

  public GroupFormationResult {
    players = List.copyOf(players);
    groups = List.copyOf(groups);
    resolutions = List.copyOf(resolutions);
    conflicts = List.copyOf(conflicts);
    nearMisses = List.copyOf(nearMisses);
  }

  public long avoidVsRequestCount() {
    return conflicts.stream().filter(c -> c.type() == RequestConflict.Type.AVOID_VS_REQUEST).count();
  }

  /** Pedidos aceitos com confiança média (aparecem como "verificar" para o usuário). */
  public List<RequestResolution> needsReview() {
    return resolutions.stream().filter(r -> r.status() == RequestResolution.Status.NEEDS_REVIEW).toList();
  }

  public List<RequestResolution> suggestions() {
    return resolutions.stream().filter(r -> r.status() == RequestResolution.Status.SUGGESTED).toList();
  }

  public List<RequestResolution> notFound() {
    return resolutions.stream().filter(r -> r.status() == RequestResolution.Status.NOT_FOUND).toList();
  }
}
