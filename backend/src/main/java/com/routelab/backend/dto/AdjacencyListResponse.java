package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdjacencyListResponse(
    boolean success,
    int vertices,
    Map<String, List<AdjacencyEntryResponse>> adjacencyList
) {
}
