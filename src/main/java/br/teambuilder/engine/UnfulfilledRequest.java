package br.teambuilder.engine;

/** Diagnóstico de um pedido de parceiro que não foi atendido na formação de grupos. */
public record UnfulfilledRequest(String name, Reason reason, RequestPriority priority) {

  public enum Reason {
    NON_RECIPROCAL("non-reciprocal"),
    GROUP_FULL("group-full"),
    CONFLICT("conflict"),
    NOT_FOUND("not-found");

    private final String code;

    Reason(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }
}
