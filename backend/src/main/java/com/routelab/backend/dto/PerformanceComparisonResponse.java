package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PerformanceComparisonResponse(
    boolean success,
    String source,
    String dest,
    String mode,
    StrategyPerformanceResponse arrayBased,
    StrategyPerformanceResponse heapBased,
    Comparison comparison
) {

  /**
   * {@code speedup} is array time over heap time.
   */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Comparison(double speedup, boolean sameResult) {
  }
}
