package com.routelab.backend.algorithms.analysis;

import com.routelab.backend.domain.Flight;

import java.util.List;

/**
 * Subgraph formed by every simple flight path of at most {@code maxHops}
 * legs from source to destination. {@code airports} always contains both
 * endpoints, even when no path exists.
 */
public record RouteSubgraphAnalysis(String source,
                                    String destination,
                                    int maxHops,
                                    List<String> airports,
                                    List<Flight> flights,
                                    int totalPaths,
                                    int directPaths,
                                    int oneStopPaths,
                                    int twoStopPaths,
                                    int sourceOutDegree,
                                    int destinationInDegree) {

  public RouteSubgraphAnalysis {
    airports = List.copyOf(airports);
    flights = List.copyOf(flights);
  }

  public int vertexCount() {
    return airports.size();
  }

  public int edgeCount() {
    return flights.size();
  }

  public double density() {
    return GraphAnalyzer.density(vertexCount(), edgeCount());
  }

  public boolean isConnected() {
    return totalPaths > 0;
  }
}
