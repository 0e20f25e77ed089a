package com.routelab.backend.config;

import com.routelab.backend.algorithms.graph.CompositeWeights;
import com.routelab.backend.algorithms.pareto.OverallRouteScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans for the plain routing classes that carry configuration.
 */
@Configuration
public class RoutingConfiguration {

  private static final Logger log = LoggerFactory.getLogger(RoutingConfiguration.class);

  /**
   * Blend used by best_overall edge weights and route scoring.
   */
  @Bean
  public CompositeWeights compositeWeights(
      @Value("${routelab.overall.price-weight:0.40}") double priceWeight,
      @Value("${routelab.overall.duration-weight:0.35}") double durationWeight,
      @Value("${routelab.overall.distance-weight:0.25}") double distanceWeight) {
    CompositeWeights weights = new CompositeWeights(priceWeight, durationWeight, distanceWeight);
    log.info("Best-overall weights: price={}, duration={}, distance={}",
        weights.price(), weights.duration(), weights.distance());
    return weights;
  }

  @Bean
  public OverallRouteScorer overallRouteScorer(CompositeWeights compositeWeights) {
    return new OverallRouteScorer(compositeWeights);
  }
}
