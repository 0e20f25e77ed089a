package com.routelab.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComponentsResponse(
    boolean success,
    int count,
    int largestSize,
    @JsonProperty("is_connected") boolean connected,
    List<List<String>> components
) {
}
