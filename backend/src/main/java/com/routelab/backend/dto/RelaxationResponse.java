package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RelaxationResponse(
    String from,
    String to,
    String flightNumber,
    double weight,
    double candidateCost,
    boolean improved,
    Double newCost
) {
}
