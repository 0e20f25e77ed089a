package com.routelab.backend.algorithms.pareto;

import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.domain.Route;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single-criterion optima side by side, plus the one with the best
 * blended score. Criteria without a route are absent from {@code optima}.
 */
public record RouteComparison(Map<OptimizationMode, Route> optima,
                              Map<OptimizationMode, Double> scores,
                              OptimizationMode bestCriterion) {

  public RouteComparison {
    optima = optima.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(optima));
    scores = scores.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(scores));
  }

  public Optional<Route> bestOverall() {
    return bestCriterion == null ? Optional.empty() : Optional.ofNullable(optima.get(bestCriterion));
  }
}
