package com.routelab.backend.algorithms.graph;

import com.routelab.backend.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Criterion a single shortest-path query minimizes.
 */
public enum OptimizationMode {

  CHEAPEST("cheapest") {
    @Override
    public EdgeWeigher weigher(FlightGraph graph, CompositeWeights weights) {
      return flight -> flight.getPrice().doubleValue();
    }
  },
  FASTEST("fastest") {
    @Override
    public EdgeWeigher weigher(FlightGraph graph, CompositeWeights weights) {
      return flight -> flight.getDurationMinutes();
    }
  },
  SHORTEST("shortest") {
    @Override
    public EdgeWeigher weigher(FlightGraph graph, CompositeWeights weights) {
      return flight -> flight.getDistanceKm();
    }
  },
  BEST_OVERALL("best_overall") {
    @Override
    public EdgeWeigher weigher(FlightGraph graph, CompositeWeights weights) {
      return CompositeWeigher.forGraph(graph, weights);
    }
  };

  private final String parameterName;

  OptimizationMode(String parameterName) {
    this.parameterName = parameterName;
  }

  public abstract EdgeWeigher weigher(FlightGraph graph, CompositeWeights weights);

  public String parameterName() {
    return parameterName;
  }

  public static OptimizationMode fromParameter(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Optimization mode must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(mode -> mode.parameterName.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new ValidationException("Unsupported optimization mode: " + value));
  }
}
