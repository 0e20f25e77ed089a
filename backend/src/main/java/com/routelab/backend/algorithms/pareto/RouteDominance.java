package com.routelab.backend.algorithms.pareto;

import com.routelab.backend.domain.Route;

/**
 * Pareto dominance over (total price, total duration, total distance).
 */
public final class RouteDominance {

  private RouteDominance() {
    // utility class
  }

  /**
   * A dominates B iff A is no worse on every metric and strictly better on one.
   */
  public static boolean dominates(Route a, Route b) {
    int price = a.getTotalPrice().compareTo(b.getTotalPrice());
    int duration = Long.compare(a.getTotalDurationMinutes(), b.getTotalDurationMinutes());
    int distance = Double.compare(a.getTotalDistanceKm(), b.getTotalDistanceKm());

    if (price > 0 || duration > 0 || distance > 0) {
      return false;
    }
    return price < 0 || duration < 0 || distance < 0;
  }
}
