package com.routelab.backend.algorithms.mst;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read-only view of a running spanning-tree construction.
 */
public interface MstFrame {

  List<String> visited();

  List<MstEdge> acceptedEdges();

  BigDecimal totalWeight();
}
