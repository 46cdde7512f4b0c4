package br.teambuilder.engine;

/**
 * Situação suspeita entre dois pedidos, só para diagnóstico (não bloqueia a formação de grupos).
 *  - AVOID_VS_REQUEST: requester pediu target, mas target evita requester
 *  - ONE_WAY_REQUEST: requester pediu target, mas target não pediu requester de volta
 */
public record RequestConflict(Type type, String requesterId, String requesterName, String targetId, String targetName) {

  public enum Type {
    AVOID_VS_REQUEST("avoid-vs-request"),
    ONE_WAY_REQUEST("one-way-request");

    private final String code;

    Type(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }
}
