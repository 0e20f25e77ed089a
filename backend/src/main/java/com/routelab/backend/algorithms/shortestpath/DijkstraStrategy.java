package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.exception.ValidationException;

import java.util.Locale;

public enum DijkstraStrategy {

  ARRAY("array", "O(V^2)", "O(V)"),
  HEAP("heap", "O((V + E) log V)", "O(V + E)");

  private final String parameterName;
  private final String timeComplexity;
  private final String spaceComplexity;

  DijkstraStrategy(String parameterName, String timeComplexity, String spaceComplexity) {
    this.parameterName = parameterName;
    this.timeComplexity = timeComplexity;
    this.spaceComplexity = spaceComplexity;
  }

  public String parameterName() {
    return parameterName;
  }

  public String timeComplexity() {
    return timeComplexity;
  }

  public String spaceComplexity() {
    return spaceComplexity;
  }

  public static DijkstraStrategy fromParameter(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Dijkstra strategy must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (DijkstraStrategy strategy : values()) {
      if (strategy.parameterName.equals(normalized)) {
        return strategy;
      }
    }
    throw new ValidationException("Unsupported Dijkstra strategy: " + value);
  }
}
