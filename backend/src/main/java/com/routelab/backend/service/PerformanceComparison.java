package com.routelab.backend.service;

import com.routelab.backend.algorithms.shortestpath.ShortestPathResult;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Same query solved by both Dijkstra strategies.
 */
public record PerformanceComparison(String source,
                                    String destination,
                                    ShortestPathResult arrayBased,
                                    ShortestPathResult heapBased) {

  /**
   * Array time divided by heap time, 2 decimals; 0 when the heap run took no measurable time.
   */
  public double speedup() {
    long heapNanos = heapBased.getElapsedNanos();
    if (heapNanos <= 0) {
      return 0.0;
    }
    double ratio = (double) arrayBased.getElapsedNanos() / heapNanos;
    return BigDecimal.valueOf(ratio).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  public boolean sameTotals() {
    return arrayBased.getDistances().equals(heapBased.getDistances())
        && arrayBased.getCameFrom().equals(heapBased.getCameFrom());
  }
}
