package com.routelab.backend.algorithms.pareto;

import com.routelab.backend.algorithms.graph.CompositeWeights;
import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.domain.Route;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Ranks a handful of routes by min-max normalized totals. A metric whose
 * values are all equal contributes 0.5 for every route. Lower is better.
 */
public final class OverallRouteScorer {

  private static final double FLAT_METRIC_SCORE = 0.5;

  private final CompositeWeights weights;

  public OverallRouteScorer(CompositeWeights weights) {
    this.weights = weights;
  }

  public RouteComparison compare(Map<OptimizationMode, Route> routesByCriterion) {
    Map<OptimizationMode, Route> optima = new EnumMap<>(OptimizationMode.class);
    optima.putAll(routesByCriterion);

    Map<OptimizationMode, Double> scores = new EnumMap<>(OptimizationMode.class);
    OptimizationMode best = null;

    for (Map.Entry<OptimizationMode, Route> entry : optima.entrySet()) {
      Route route = entry.getValue();
      double score = weights.price() * normalize(optima, route, r -> r.getTotalPrice().doubleValue())
          + weights.duration() * normalize(optima, route, Route::getTotalDurationMinutes)
          + weights.distance() * normalize(optima, route, Route::getTotalDistanceKm);
      scores.put(entry.getKey(), score);

      // declaration order decides ties
      if (best == null || score < scores.get(best)) {
        best = entry.getKey();
      }
    }
    return new RouteComparison(optima, scores, best);
  }

  private double normalize(Map<OptimizationMode, Route> optima, Route route, ToDoubleFunction<Route> metric) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (Route candidate : optima.values()) {
      double value = metric.applyAsDouble(candidate);
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    if (max - min <= 0.0) {
      return FLAT_METRIC_SCORE;
    }
    return (metric.applyAsDouble(route) - min) / (max - min);
  }
}
