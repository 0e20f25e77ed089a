package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdjacencyEntryResponse(
    String to,
    String flightNumber,
    String airline,
    BigDecimal price,
    int durationMinutes
) {
}
