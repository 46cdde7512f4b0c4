package br.teambuilder.engine;

import java.util.List;

/** Grupo que quase se formou maior: overflowIds ficaram de fora pelo limite de tamanho. */
public record NearMiss(String groupId, List<String> memberIds, List<String> overflowIds, String reason) {

  public static final String GROUP_TOO_LARGE = "group-too-large";

  public NearMiss {
    memberIds = List.copyOf(memberIds);
    overflowIds = List.copyOf(overflowIds);
  }
}
