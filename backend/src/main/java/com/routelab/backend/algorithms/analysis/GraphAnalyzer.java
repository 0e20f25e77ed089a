package com.routelab.backend.algorithms.analysis;

import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.domain.Flight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/**
 * Structural queries over a {@link FlightGraph}.
 *
 * Responsibilities:
 *  - Adjacency list and price-matrix views.
 *  - Degree and density statistics.
 *  - Directed reachability and weakly connected components (BFS).
 *  - Bounded-hop subgraph between two airports (DFS over simple paths).
 */
@Component
public class GraphAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(GraphAnalyzer.class);

  // ---------------------------------------------------------------------------
  // Adjacency views
  // ---------------------------------------------------------------------------

  /**
   * Origin code -> outgoing flights, for every airport that has any flight.
   */
  public Map<String, List<AdjacencyEntry>> adjacencyList(FlightGraph graph) {
    Map<String, List<AdjacencyEntry>> result = new TreeMap<>();
    Set<String> involved = new TreeSet<>();
    for (Flight flight : graph.flights()) {
      involved.add(flight.getOriginCode());
      involved.add(flight.getDestinationCode());
    }

    for (String code : involved) {
      List<AdjacencyEntry> entries = graph.outgoing(code).stream()
          .map(f -> new AdjacencyEntry(
              f.getDestinationCode(),
              f.getFlightNumber(),
              f.getAirline(),
              f.getPrice(),
              f.getDurationMinutes()))
          .toList();
      result.put(code, entries);
    }
    return Collections.unmodifiableMap(result);
  }

  public AdjacencyMatrix adjacencyMatrix(FlightGraph graph) {
    List<String> codes = graph.airportCodes();
    List<List<BigDecimal>> rows = new ArrayList<>(codes.size());

    for (String from : codes) {
      List<BigDecimal> row = new ArrayList<>(codes.size());
      for (String to : codes) {
        row.add(cheapestFare(graph, from, to));
      }
      rows.add(row);
    }
    return new AdjacencyMatrix(codes, rows);
  }

  private BigDecimal cheapestFare(FlightGraph graph, String from, String to) {
    if (from.equals(to)) {
      return BigDecimal.ZERO;
    }
    return graph.flightsBetween(from, to).stream()
        .map(Flight::getPrice)
        .min(Comparator.naturalOrder())
        .orElse(BigDecimal.ZERO);
  }

  // ---------------------------------------------------------------------------
  // Statistics
  // ---------------------------------------------------------------------------

  public GraphStatistics statistics(FlightGraph graph) {
    Map<String, Integer> outDegrees = new TreeMap<>();
    Map<String, Integer> inDegrees = new TreeMap<>();
    for (String code : graph.airportCodes()) {
      outDegrees.put(code, graph.outgoing(code).size());
      inDegrees.put(code, graph.incoming(code).size());
    }

    int vertices = graph.vertexCount();
    int edges = graph.edgeCount();
    int max = outDegrees.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    int min = outDegrees.values().stream().mapToInt(Integer::intValue).min().orElse(0);
    double average = vertices == 0 ? 0.0 : round((double) edges / vertices, 2);

    return new GraphStatistics(
        vertices,
        edges,
        density(vertices, edges),
        average,
        max,
        min,
        Collections.unmodifiableMap(outDegrees),
        Collections.unmodifiableMap(inDegrees)
    );
  }

  /**
   * E / (V * (V - 1)) rounded to 4 decimals; 0 for fewer than two vertices.
   */
  static double density(int vertices, int edges) {
    if (vertices < 2) {
      return 0.0;
    }
    return round((double) edges / ((double) vertices * (vertices - 1)), 4);
  }

  private static double round(double value, int places) {
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }

  // ---------------------------------------------------------------------------
  // Connectivity
  // ---------------------------------------------------------------------------

  /**
   * Directed BFS from source. The reported path has the fewest hops; among
   * equally short paths the one through smaller codes wins.
   */
  public ConnectivityResult connectivity(FlightGraph graph, String sourceCode, String destinationCode) {
    graph.requireEndpoints(sourceCode, destinationCode);

    Map<String, String> parent = new HashMap<>();
    Set<String> seen = new HashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    seen.add(sourceCode);
    queue.add(sourceCode);

    while (!queue.isEmpty()) {
      String current = queue.poll();
      for (String next : graph.successors(current)) {
        if (seen.add(next)) {
          parent.put(next, current);
          queue.add(next);
        }
      }
    }

    List<String> reachable = new ArrayList<>(new TreeSet<>(seen));
    if (!seen.contains(destinationCode)) {
      return new ConnectivityResult(sourceCode, destinationCode, false, -1, List.of(), reachable);
    }

    LinkedList<String> path = new LinkedList<>();
    for (String node = destinationCode; node != null; node = parent.get(node)) {
      path.addFirst(node);
    }
    return new ConnectivityResult(sourceCode, destinationCode, true, path.size() - 1, List.copyOf(path), reachable);
  }

  /**
   * Components of the graph with edge direction ignored.
   */
  public ConnectedComponents connectedComponents(FlightGraph graph) {
    Set<String> assigned = new HashSet<>();
    List<List<String>> components = new ArrayList<>();

    for (String start : graph.airportCodes()) {
      if (assigned.contains(start)) {
        continue;
      }
      components.add(weakComponentOf(graph, start, assigned));
    }

    components.sort(Comparator.<List<String>>comparingInt(List::size).reversed()
        .thenComparing(c -> c.get(0)));
    return new ConnectedComponents(components);
  }

  /**
   * Sorted airport codes weakly connected to {@code start}.
   */
  public List<String> weakComponent(FlightGraph graph, String start) {
    graph.airport(start);
    return weakComponentOf(graph, start, new HashSet<>());
  }

  private List<String> weakComponentOf(FlightGraph graph, String start, Set<String> assigned) {
    SortedSet<String> component = new TreeSet<>();
    Deque<String> queue = new ArrayDeque<>();
    assigned.add(start);
    queue.add(start);

    while (!queue.isEmpty()) {
      String current = queue.poll();
      component.add(current);

      List<String> neighbors = new ArrayList<>(graph.successors(current));
      for (Flight inbound : graph.incoming(current)) {
        neighbors.add(inbound.getOriginCode());
      }
      for (String next : neighbors) {
        if (assigned.add(next)) {
          queue.add(next);
        }
      }
    }
    return new ArrayList<>(component);
  }

  // ---------------------------------------------------------------------------
  // Route subgraph
  // ---------------------------------------------------------------------------

  public RouteSubgraphAnalysis analyzeRoute(FlightGraph graph, String sourceCode, String destinationCode, int maxHops) {
    graph.requireEndpoints(sourceCode, destinationCode);
    if (maxHops < 1) {
      throw new IllegalArgumentException("maxHops must be at least 1: " + maxHops);
    }

    PathTally tally = new PathTally();
    if (!sourceCode.equals(destinationCode)) {
      Deque<String> visiting = new ArrayDeque<>();
      visiting.add(sourceCode);
      dfsFlightPaths(graph, sourceCode, destinationCode, maxHops, visiting, new ArrayDeque<>(), tally);
    }

    SortedSet<String> airports = new TreeSet<>();
    airports.add(sourceCode);
    airports.add(destinationCode);
    for (Flight flight : tally.flights) {
      airports.add(flight.getOriginCode());
      airports.add(flight.getDestinationCode());
    }

    List<Flight> flights = new ArrayList<>(tally.flights);
    flights.sort(Comparator.comparing(Flight::getOriginCode)
        .thenComparing(Flight::getDestinationCode)
        .thenComparing(Flight::getFlightNumber));

    log.debug("Route subgraph {} -> {} within {} hops: {} paths, {} airports, {} flights",
        sourceCode, destinationCode, maxHops, tally.total, airports.size(), flights.size());

    return new RouteSubgraphAnalysis(
        sourceCode,
        destinationCode,
        maxHops,
        new ArrayList<>(airports),
        flights,
        tally.total,
        tally.byLegs(1),
        tally.byLegs(2),
        tally.byLegs(3),
        graph.outgoing(sourceCode).size(),
        graph.incoming(destinationCode).size()
    );
  }

  private void dfsFlightPaths(FlightGraph graph,
      String current,
      String target,
      int remainingLegs,
      Deque<String> visiting,
      Deque<Flight> legs,
      PathTally tally) {
    if (current.equals(target)) {
      tally.add(legs);
      return;
    }
    if (remainingLegs == 0) {
      return;
    }

    for (Flight flight : graph.outgoing(current)) {
      String next = flight.getDestinationCode();
      if (visiting.contains(next)) {
        continue;
      }
      visiting.addLast(next);
      legs.addLast(flight);
      dfsFlightPaths(graph, next, target, remainingLegs - 1, visiting, legs, tally);
      legs.removeLast();
      visiting.removeLast();
    }
  }

  private static final class PathTally {

    private final Set<Flight> flights = new LinkedHashSet<>();
    private final Map<Integer, Integer> countsByLegs = new HashMap<>();
    private int total;

    void add(Collection<Flight> legs) {
      flights.addAll(legs);
      countsByLegs.merge(legs.size(), 1, Integer::sum);
      total++;
    }

    int byLegs(int legs) {
      return countsByLegs.getOrDefault(legs, 0);
    }
  }
}
