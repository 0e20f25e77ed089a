package com.routelab.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RouteAnalysisResponse(
    boolean success,
    String source,
    String dest,
    int maxHops,
    List<String> airports,
    List<LegResponse> flights,
    int vertices,
    int edges,
    double density,
    int totalPaths,
    int directPaths,
    int oneStopPaths,
    int twoStopPaths,
    int sourceOutDegree,
    int destInDegree,
    @JsonProperty("is_connected") boolean connected
) {
}
