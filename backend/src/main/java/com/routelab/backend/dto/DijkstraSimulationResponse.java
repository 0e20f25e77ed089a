package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Trace of one Dijkstra run. {@code route} is null when the destination
 * could not be reached.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DijkstraSimulationResponse(
    boolean success,
    String strategy,
    String mode,
    RouteResponse route,
    List<SearchStateResponse> states,
    int totalStates,
    boolean statesTruncated,
    Map<String, Double> distances,
    Map<String, String> cameFrom,
    List<String> visitOrder,
    OperationsResponse operations
) {
}
