package com.routelab.backend.algorithms.mst;

import java.math.BigDecimal;
import java.util.List;

/**
 * Snapshot of a spanning-tree construction. {@code consideredEdge} is null
 * on START and FINISH steps.
 */
public record MstState(int step,
                       MstStepKind kind,
                       List<String> visited,
                       List<MstEdge> mstEdges,
                       MstEdge consideredEdge,
                       BigDecimal totalWeight) {
}
