package com.routelab.backend.algorithms.mst;

import com.routelab.backend.domain.Flight;

import java.util.*;

/**
 * Undirected view of a set of airports where every flight in either
 * direction between two airports collapses to one edge carrying the
 * minimum price. Ties keep the smaller flight number.
 */
public final class UndirectedPriceGraph {

  private final List<String> vertices;
  private final List<MstEdge> edges;
  private final Map<String, List<MstEdge>> incident;
  private final String startVertex;

  private UndirectedPriceGraph(List<String> vertices, List<MstEdge> edges, String startVertex) {
    this.vertices = List.copyOf(vertices);
    this.edges = List.copyOf(edges);
    this.startVertex = startVertex;

    Map<String, List<MstEdge>> byVertex = new HashMap<>();
    for (MstEdge edge : edges) {
      byVertex.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
      byVertex.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
    }
    Map<String, List<MstEdge>> frozen = new HashMap<>();
    byVertex.forEach((code, list) -> frozen.put(code, List.copyOf(list)));
    this.incident = Collections.unmodifiableMap(frozen);
  }

  /**
   * @param vertices    airports in scope
   * @param flights     candidate flights; those leaving the scope are ignored
   * @param startVertex where Prim starts; null picks the smallest code
   */
  public static UndirectedPriceGraph of(Collection<String> vertices, Collection<Flight> flights, String startVertex) {
    SortedSet<String> scope = new TreeSet<>(vertices);
    if (startVertex != null && !scope.contains(startVertex)) {
      throw new IllegalArgumentException("Start vertex " + startVertex + " is not part of the scope");
    }

    Map<List<String>, MstEdge> cheapest = new HashMap<>();
    for (Flight flight : flights) {
      String a = flight.getOriginCode();
      String b = flight.getDestinationCode();
      if (!scope.contains(a) || !scope.contains(b)) {
        continue;
      }
      String low = a.compareTo(b) < 0 ? a : b;
      String high = a.compareTo(b) < 0 ? b : a;
      MstEdge candidate = new MstEdge(low, high, flight.getPrice(), flight.getFlightNumber(), flight.getAirline());

      cheapest.merge(List.of(low, high), candidate, UndirectedPriceGraph::cheaper);
    }

    List<MstEdge> edges = new ArrayList<>(cheapest.values());
    edges.sort(MstEdge.ORDER);

    String start = startVertex != null ? startVertex : (scope.isEmpty() ? null : scope.first());
    return new UndirectedPriceGraph(new ArrayList<>(scope), edges, start);
  }

  private static MstEdge cheaper(MstEdge a, MstEdge b) {
    int byWeight = a.weight().compareTo(b.weight());
    if (byWeight != 0) {
      return byWeight < 0 ? a : b;
    }
    return a.flightNumber().compareTo(b.flightNumber()) <= 0 ? a : b;
  }

  /**
   * Airport codes in ascending order.
   */
  public List<String> vertices() {
    return vertices;
  }

  /**
   * Edges sorted by {@link MstEdge#ORDER}.
   */
  public List<MstEdge> edges() {
    return edges;
  }

  public List<MstEdge> incidentEdges(String code) {
    return incident.getOrDefault(code, List.of());
  }

  public Optional<String> startVertex() {
    return Optional.ofNullable(startVertex);
  }

  public int vertexCount() {
    return vertices.size();
  }

  public int edgeCount() {
    return edges.size();
  }
}
