package com.routelab.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Envelope of {@code /api/routes/find}. A single-criterion query fills
 * {@code route}; the "all" query fills {@code routes} and {@code algorithmResults}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RouteSearchResponse(
    boolean success,
    String algorithmUsed,
    RouteResponse route,
    Integer totalRoutes,
    Integer maxStops,
    List<RouteResponse> routes,
    AlgorithmResultsResponse algorithmResults,
    String error
) {

  public static RouteSearchResponse single(String algorithmUsed, RouteResponse route) {
    return new RouteSearchResponse(true, algorithmUsed, route, null, null, null, null, null);
  }

  public static RouteSearchResponse listing(List<RouteResponse> routes, int maxStops, AlgorithmResultsResponse results) {
    return new RouteSearchResponse(true, "all", null, routes.size(), maxStops, routes, results, null);
  }

  public static RouteSearchResponse noRoute(String algorithmUsed, String message) {
    return new RouteSearchResponse(false, algorithmUsed, null, null, null, null, null, message);
  }
}
