package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * One replayable step of a Dijkstra run.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchStateResponse(
    int step,
    String kind,
    String currentNode,
    List<String> visited,
    List<FrontierEntryResponse> frontier,
    Map<String, Double> distances,
    Map<String, String> cameFrom,
    RelaxationResponse relaxation,
    List<String> routePath
) {
}
