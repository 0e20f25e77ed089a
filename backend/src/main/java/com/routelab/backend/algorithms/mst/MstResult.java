package com.routelab.backend.algorithms.mst;

import java.math.BigDecimal;
import java.util.List;

/**
 * Spanning tree (or forest, when the scope is disconnected) and its trace.
 */
public record MstResult(MstAlgorithm algorithm,
                        List<String> airports,
                        List<MstEdge> edges,
                        BigDecimal totalWeight,
                        List<MstState> trace,
                        boolean traceTruncated) {

  public MstResult {
    airports = List.copyOf(airports);
    edges = List.copyOf(edges);
    trace = List.copyOf(trace);
  }

  /**
   * True when the tree reaches every airport in scope.
   */
  public boolean isSpanning() {
    return edges.size() == airports.size() - 1;
  }
}
