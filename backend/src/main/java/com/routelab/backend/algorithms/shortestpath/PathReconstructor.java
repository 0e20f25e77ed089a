package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.algorithms.graph.WeightedFlightGraph;
import com.routelab.backend.algorithms.graph.WeightedFlightGraph.WeightedEdge;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.domain.Route;
import com.routelab.backend.exception.GraphInvariantException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Walks parent pointers from the destination back to the source.
 */
final class PathReconstructor {

  private PathReconstructor() {
    // utility class
  }

  static Route reconstruct(WeightedFlightGraph graph, WeightedEdge[] parents, int source, int target) {
    List<Flight> legs = new ArrayList<>();
    int node = target;

    while (node != source) {
      // a simple path has fewer legs than vertices
      if (legs.size() >= graph.vertexCount()) {
        throw new GraphInvariantException("Cycle in parent pointers while reconstructing path to "
            + graph.codeAt(target));
      }
      WeightedEdge via = parents[node];
      if (via == null) {
        throw new GraphInvariantException("Parent chain of " + graph.codeAt(target)
            + " breaks at " + graph.codeAt(node) + " before reaching the source");
      }
      legs.add(via.flight());
      node = graph.indexOf(via.flight().getOriginCode());
    }

    Collections.reverse(legs);
    try {
      return new Route(legs);
    } catch (IllegalArgumentException e) {
      throw new GraphInvariantException("Parent chain of " + graph.codeAt(target)
          + " does not form a connected route: " + e.getMessage(), e);
    }
  }
}
