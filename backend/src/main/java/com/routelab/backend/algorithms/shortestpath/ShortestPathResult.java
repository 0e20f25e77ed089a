package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.domain.Route;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Outcome of one shortest-path query. An empty route means no route exists.
 */
public final class ShortestPathResult {

  private final DijkstraStrategy strategy;
  private final Route route;
  private final Map<String, Double> distances;
  private final Map<String, String> cameFrom;
  private final List<String> visitOrder;
  private final OperationCounters operations;
  private final long elapsedNanos;
  private final int vertexCount;
  private final int edgeCount;
  private final List<SearchState> trace;
  private final boolean traceTruncated;

  ShortestPathResult(DijkstraStrategy strategy,
      Route route,
      Map<String, Double> distances,
      Map<String, String> cameFrom,
      List<String> visitOrder,
      OperationCounters operations,
      long elapsedNanos,
      int vertexCount,
      int edgeCount,
      List<SearchState> trace,
      boolean traceTruncated) {
    this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
    this.route = route;
    this.distances = Collections.unmodifiableMap(new TreeMap<>(distances));
    this.cameFrom = Collections.unmodifiableMap(new TreeMap<>(cameFrom));
    this.visitOrder = List.copyOf(visitOrder);
    this.operations = Objects.requireNonNull(operations, "operations must not be null");
    this.elapsedNanos = elapsedNanos;
    this.vertexCount = vertexCount;
    this.edgeCount = edgeCount;
    this.trace = List.copyOf(trace);
    this.traceTruncated = traceTruncated;
  }

  ShortestPathResult withTrace(List<SearchState> states, boolean truncated) {
    return new ShortestPathResult(strategy, route, distances, cameFrom, visitOrder, operations,
        elapsedNanos, vertexCount, edgeCount, states, truncated);
  }

  public DijkstraStrategy getStrategy() {
    return strategy;
  }

  public Optional<Route> getRoute() {
    return Optional.ofNullable(route);
  }

  public boolean isFound() {
    return route != null;
  }

  public Map<String, Double> getDistances() {
    return distances;
  }

  public Map<String, String> getCameFrom() {
    return cameFrom;
  }

  public List<String> getVisitOrder() {
    return visitOrder;
  }

  public OperationCounters getOperations() {
    return operations;
  }

  public long getElapsedNanos() {
    return elapsedNanos;
  }

  public double getElapsedMillis() {
    return elapsedNanos / 1_000_000.0;
  }

  public int getVertexCount() {
    return vertexCount;
  }

  public int getEdgeCount() {
    return edgeCount;
  }

  public List<SearchState> getTrace() {
    return trace;
  }

  public boolean isTraceTruncated() {
    return traceTruncated;
  }
}
