package com.routelab.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MstResponse(
    boolean success,
    String algorithm,
    String scope,
    String source,
    String dest,
    List<String> airports,
    List<MstEdgeResponse> mstEdges,
    BigDecimal totalWeight,
    @JsonProperty("is_spanning") boolean spanning,
    List<MstStateResponse> states,
    int totalStates,
    boolean statesTruncated
) {
}
