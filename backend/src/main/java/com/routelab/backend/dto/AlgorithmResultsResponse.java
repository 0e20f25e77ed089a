package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Per-criterion optima shown next to an "all routes" listing.
 * A criterion without a route is null.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlgorithmResultsResponse(
    RouteResponse cheapest,
    RouteResponse fastest,
    RouteResponse shortest,
    RouteResponse bestOverall,
    String algorithmUsed,
    Map<String, Double> scores
) {
}
