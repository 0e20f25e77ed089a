package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GraphStatsResponse(
    boolean success,
    int vertices,
    int edges,
    double density,
    double averageDegree,
    int maxDegree,
    int minDegree,
    Map<String, Integer> outDegrees,
    Map<String, Integer> inDegrees
) {
}
