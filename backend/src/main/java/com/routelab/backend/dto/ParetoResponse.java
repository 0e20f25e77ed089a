package com.routelab.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParetoResponse(
    boolean success,
    List<RouteResponse> routes,
    List<RouteResponse> allCandidates,
    int paretoCount,
    int totalCandidates,
    String algorithmUsed,
    String error
) {
}
