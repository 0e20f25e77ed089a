package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LegResponse(
    String flightNumber,
    String airline,
    String origin,
    String destination,
    String departureTime,   // HH:mm, null when the dataset has no schedule
    String arrivalTime,
    int durationMinutes,
    BigDecimal price,
    double distanceKm
) {
}
