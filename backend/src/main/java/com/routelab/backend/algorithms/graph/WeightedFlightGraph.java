package com.routelab.backend.algorithms.graph;

import com.routelab.backend.domain.Flight;
import com.routelab.backend.exception.GraphInvariantException;

import java.util.*;

/**
 * Index-based view of a {@link FlightGraph} with one edge weigher applied.
 * Airports are numbered in ascending code order; each adjacency list is
 * ordered by weight, then destination code, then flight number.
 */
public final class WeightedFlightGraph {

  private final FlightGraph graph;
  private final List<String> codes;
  private final Map<String, Integer> indexByCode;
  private final List<List<WeightedEdge>> adjacency;
  private final int edgeCount;

  WeightedFlightGraph(FlightGraph graph, EdgeWeigher weigher) {
    this.graph = Objects.requireNonNull(graph, "graph must not be null");
    Objects.requireNonNull(weigher, "weigher must not be null");

    this.codes = graph.airportCodes();
    Map<String, Integer> indexes = new HashMap<>();
    for (int i = 0; i < codes.size(); i++) {
      indexes.put(codes.get(i), i);
    }
    this.indexByCode = Collections.unmodifiableMap(indexes);

    List<List<WeightedEdge>> lists = new ArrayList<>(codes.size());
    int edges = 0;
    for (String code : codes) {
      List<WeightedEdge> neighbors = new ArrayList<>();
      for (Flight flight : graph.outgoing(code)) {
        double weight = weigher.weigh(flight);
        if (!Double.isFinite(weight) || weight < 0.0) {
          throw new GraphInvariantException("Invalid edge weight " + weight + " on flight " + flight);
        }
        neighbors.add(new WeightedEdge(flight, indexes.get(flight.getDestinationCode()), weight));
      }
      neighbors.sort(WeightedEdge.ORDER);
      lists.add(List.copyOf(neighbors));
      edges += neighbors.size();
    }
    this.adjacency = List.copyOf(lists);
    this.edgeCount = edges;
  }

  public FlightGraph graph() {
    return graph;
  }

  public int vertexCount() {
    return codes.size();
  }

  public int edgeCount() {
    return edgeCount;
  }

  public int indexOf(String code) {
    Integer index = indexByCode.get(code);
    if (index == null) {
      // delegate to the graph for the exception type
      graph.airport(code);
      throw new GraphInvariantException("Airport " + code + " missing from weighted index");
    }
    return index;
  }

  public String codeAt(int index) {
    return codes.get(index);
  }

  public List<WeightedEdge> neighbors(int index) {
    return adjacency.get(index);
  }

  public List<WeightedEdge> neighbors(String code) {
    return adjacency.get(indexOf(code));
  }

  /**
   * A flight with its precomputed weight and target vertex index.
   */
  public record WeightedEdge(Flight flight, int target, double weight) {

    static final Comparator<WeightedEdge> ORDER =
        Comparator.comparingDouble(WeightedEdge::weight)
            .thenComparing(e -> e.flight().getDestinationCode())
            .thenComparing(e -> e.flight().getFlightNumber());
  }
}
