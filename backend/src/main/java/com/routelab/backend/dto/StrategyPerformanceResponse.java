package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StrategyPerformanceResponse(
    double executionTimeMs,
    OperationsResponse operations,
    boolean foundPath,
    int vertices,
    int edges,
    String timeComplexity,
    String spaceComplexity,
    RouteResponse route
) {
}
