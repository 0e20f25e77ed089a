package com.routelab.backend.algorithms.analysis;

import java.math.BigDecimal;
import java.util.List;

/**
 * Square price matrix over {@code airports} (sorted by code). A cell holds
 * the cheapest direct fare from row to column, or 0 when there is none.
 */
public record AdjacencyMatrix(List<String> airports, List<List<BigDecimal>> cells) {

  public AdjacencyMatrix {
    airports = List.copyOf(airports);
    cells = cells.stream().map(List::copyOf).toList();
  }

  public BigDecimal cell(String from, String to) {
    return cells.get(airports.indexOf(from)).get(airports.indexOf(to));
  }
}
