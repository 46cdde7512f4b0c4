package br.teambuilder.api;

import br.teambuilder.engine.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Liga as chaves teambuilder.* do application.properties aos parâmetros do engine. */
@Configuration
public class EngineConfiguration {

  private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

  @Bean
  public EngineSettings engineSettings(
      @Value("${teambuilder.resolution.threshold:0.6}") double resolutionThreshold,
      @Value("${teambuilder.resolution.suggestion-threshold:0.3}") double suggestionThreshold,
      @Value("${teambuilder.resolution.avoid-threshold:0.8}") double avoidThreshold,
      @Value("${teambuilder.balancer.max-passes:10}") int maxPasses,
      @Value("${teambuilder.balancer.spread-threshold:0.5}") double spreadThreshold,
      @Value("${teambuilder.balancer.sample-size:4}") int sampleSize,
      @Value("${teambuilder.balancer.min-improvement:0.01}") double minImprovement,
      @Value("${teambuilder.balancer.handler-target:2}") int handlerTarget,
      @Value("${teambuilder.balancer.role-weight:0.25}") double roleWeight) {

    EngineSettings s = new EngineSettings(resolutionThreshold, suggestionThreshold, avoidThreshold,
        maxPasses, spreadThreshold, sampleSize, minImprovement, handlerTarget, roleWeight);
    log.info("Engine settings: {}", s);
    return s;
  }
}
