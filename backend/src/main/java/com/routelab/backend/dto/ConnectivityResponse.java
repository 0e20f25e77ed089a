package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * {@code hops} is -1 when {@code reachable} is false.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConnectivityResponse(
    boolean success,
    String source,
    String dest,
    boolean reachable,
    int hops,
    List<String> path,
    List<String> reachableAirports
) {
}
