package br.teambuilder.engine;

/**
 * Como um pedido em texto livre ("mikesmith") foi resolvido contra o elenco.
 *
 * resolved != null somente para ACCEPTED/NEEDS_REVIEW; SUGGESTED traz apenas o melhor
 * candidato (nunca aplicado automaticamente).
 */
public record RequestResolution(
    String requesterId,
    String request,
    int index,
    RequestPriority priority,
    Status status,
    Player resolved,
    NameMatch best) {

  public enum Status {
    ACCEPTED,
    NEEDS_REVIEW,
    SUGGESTED,
    NOT_FOUND
  }

  public boolean accepted() {
    return status == Status.ACCEPTED || status == Status.NEEDS_REVIEW;
  }

  public String resolvedId() {
    return resolved == null ? null : resolved.id();
  }
}
