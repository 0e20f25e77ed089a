package com.routelab.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MstStateResponse(
    int step,
    String kind,
    List<String> visited,
    List<MstEdgeResponse> mstEdges,
    MstEdgeResponse consideredEdge,
    Boolean accepted,       // null on start/finish steps
    BigDecimal totalWeight
) {
}
