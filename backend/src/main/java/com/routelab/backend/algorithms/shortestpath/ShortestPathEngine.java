package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.algorithms.graph.CompositeWeights;
import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.algorithms.graph.WeightedFlightGraph;

/**
 * Single-source shortest-path solver over non-negative flight weights.
 *
 * Implementations must finalize airports in (cost, code) order and only
 * accept strictly cheaper relaxations, so every strategy returns the same
 * distances and parent pointers for the same input.
 */
public interface ShortestPathEngine {

  DijkstraStrategy strategy();

  /**
   * Run the search on an already weighted graph. The search stops as soon
   * as the destination is finalized.
   */
  ShortestPathResult search(WeightedFlightGraph graph,
      String sourceCode,
      String destinationCode,
      SearchObserver observer);

  /**
   * Weigh the graph for {@code mode}, run the search and attach a trace of at
   * most {@code maxStates} snapshots.
   */
  default ShortestPathResult solve(FlightGraph graph,
      String sourceCode,
      String destinationCode,
      OptimizationMode mode,
      CompositeWeights weights,
      int maxStates) {
    graph.requireEndpoints(sourceCode, destinationCode);
    SearchTraceRecorder recorder = new SearchTraceRecorder(maxStates);
    WeightedFlightGraph weighted = graph.weighted(mode.weigher(graph, weights));
    ShortestPathResult result = search(weighted, sourceCode, destinationCode, recorder);
    return result.withTrace(recorder.states(), recorder.isTruncated());
  }

  default ShortestPathResult solve(FlightGraph graph,
      String sourceCode,
      String destinationCode,
      OptimizationMode mode,
      int maxStates) {
    return solve(graph, sourceCode, destinationCode, mode, CompositeWeights.DEFAULT, maxStates);
  }
}
