package com.routelab.backend.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Row i / column j follow {@code airports}; a cell holds the cheapest
 * direct fare, 0 when there is none.
 */
public record AdjacencyMatrixResponse(
    boolean success,
    List<String> airports,
    List<List<BigDecimal>> matrix
) {
}
