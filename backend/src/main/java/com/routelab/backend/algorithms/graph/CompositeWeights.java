package com.routelab.backend.algorithms.graph;

/**
 * Relative importance of price, duration and distance for best-overall
 * scoring. Weights are rescaled so they sum to 1.
 */
public record CompositeWeights(double price, double duration, double distance) {

  public static final CompositeWeights DEFAULT = new CompositeWeights(0.40, 0.35, 0.25);

  public CompositeWeights {
    if (!isUsable(price) || !isUsable(duration) || !isUsable(distance)) {
      throw new IllegalArgumentException(
          "Composite weights must be finite and non-negative: " + price + ", " + duration + ", " + distance);
    }
    double sum = price + duration + distance;
    if (sum <= 0.0) {
      throw new IllegalArgumentException("At least one composite weight must be positive");
    }
    price = price / sum;
    duration = duration / sum;
    distance = distance / sum;
  }

  private static boolean isUsable(double weight) {
    return Double.isFinite(weight) && weight >= 0.0;
  }
}
