package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;

/**
 * API response model for a route.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RouteResponse(
    List<String> path,
    List<LegResponse> legs,
    int stops,
    BigDecimal totalPrice,
    long totalDurationMinutes,
    double totalDistanceKm,
    List<CoordinateResponse> coordinates
) {
}
