package br.teambuilder.engine;

public enum RequestPriority {
  MUST_HAVE,
  NICE_TO_HAVE;

  public static RequestPriority ofIndex(int index) {
    return index == 0 ? MUST_HAVE : NICE_TO_HAVE;
  }

  public String code() {
    return this == MUST_HAVE ? "must-have" : "nice-to-have";
  }
}
