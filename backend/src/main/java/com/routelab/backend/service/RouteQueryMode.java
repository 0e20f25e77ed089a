package com.routelab.backend.service;

import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.exception.ValidationException;

import java.util.Locale;
import java.util.Optional;

/**
 * What a route query returns: one optimum, every simple route ("all"),
 * or the Pareto-optimal set ("pareto").
 */
public enum RouteQueryMode {

  CHEAPEST("cheapest", OptimizationMode.CHEAPEST),
  FASTEST("fastest", OptimizationMode.FASTEST),
  SHORTEST("shortest", OptimizationMode.SHORTEST),
  BEST_OVERALL("best_overall", OptimizationMode.BEST_OVERALL),
  ALL("all", null),
  PARETO("pareto", null);

  private final String parameterName;
  private final OptimizationMode optimization;

  RouteQueryMode(String parameterName, OptimizationMode optimization) {
    this.parameterName = parameterName;
    this.optimization = optimization;
  }

  public String parameterName() {
    return parameterName;
  }

  /**
   * The single criterion to optimize, empty for {@link #ALL} and {@link #PARETO}.
   */
  public Optional<OptimizationMode> optimization() {
    return Optional.ofNullable(optimization);
  }

  public static RouteQueryMode fromParameter(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("optimization must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (RouteQueryMode mode : values()) {
      if (mode.parameterName.equals(normalized)) {
        return mode;
      }
    }
    throw new ValidationException("Unsupported optimization: " + value);
  }
}
