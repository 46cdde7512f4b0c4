package br.teambuilder.engine;

/**
 * Parâmetros ajustáveis do engine.
 *
 * Fora do Spring: java -Dteambuilder.balancer.max-passes=20 ... (ver fromSystemProperties).
 * No Spring: mesmas chaves em application.properties (EngineConfiguration).
 */
public record EngineSettings(
    double resolutionThreshold,
    double suggestionThreshold,
    double avoidThreshold,
    int balancerMaxPasses,
    double balancerSpreadThreshold,
    int balancerSampleSize,
    double balancerMinImprovement,
    int handlerTarget,
    double roleWeight) {

  public EngineSettings {
    if (resolutionThreshold <= 0 || resolutionThreshold > 1) {
      throw new IllegalArgumentException("resolutionThreshold fora de (0,1]: " + resolutionThreshold);
    }
    if (suggestionThreshold < 0 || suggestionThreshold > resolutionThreshold) {
      throw new IllegalArgumentException("suggestionThreshold inválido: " + suggestionThreshold);
    }
    if (balancerMaxPasses < 0) throw new IllegalArgumentException("balancerMaxPasses < 0");
    if (balancerSampleSize < 1) throw new IllegalArgumentException("balancerSampleSize < 1");
  }

  public static EngineSettings defaults() {
    return new EngineSettings(0.6, 0.3, 0.8, 10, 0.5, 4, 0.01, 2, 0.25);
  }

  public static EngineSettings fromSystemProperties() {
    EngineSettings d = defaults();
    return new EngineSettings(
        doubleProp("teambuilder.resolution.threshold", d.resolutionThreshold()),
        doubleProp("teambuilder.resolution.suggestion-threshold", d.suggestionThreshold()),
        doubleProp("teambuilder.resolution.avoid-threshold", d.avoidThreshold()),
        intProp("teambuilder.balancer.max-passes", d.balancerMaxPasses()),
        doubleProp("teambuilder.balancer.spread-threshold", d.balancerSpreadThreshold()),
        intProp("teambuilder.balancer.sample-size", d.balancerSampleSize()),
        doubleProp("teambuilder.balancer.min-improvement", d.balancerMinImprovement()),
        intProp("teambuilder.balancer.handler-target", d.handlerTarget()),
        doubleProp("teambuilder.balancer.role-weight", d.roleWeight()));
  }

  private static double doubleProp(String key, double def) {
    String v = System.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Double.parseDouble(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Valor inválido para " + key + ": " + v, e);
    }
  }

  private static int intProp(String key, int def) {
    String v = System.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Valor inválido para " + key + ": " + v, e);
    }
  }
}
