package com.routelab.backend.algorithms.analysis;

import com.routelab.backend.ExampleNetwork;
import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.exception.UnknownAirportException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GraphAnalyzer} against the six-airport example network.
 */
class GraphAnalyzerTest {

  private final GraphAnalyzer analyzer = new GraphAnalyzer();
  private final FlightGraph graph = ExampleNetwork.graph();

  // ---------------------------------------------------------------------------
  // Views and statistics
  // ---------------------------------------------------------------------------

  @Test
  void statistics_shouldReportDensityAndDegrees() {
    GraphStatistics stats = analyzer.statistics(graph);

    assertEquals(6, stats.vertices());
    assertEquals(7, stats.edges());
    assertEquals(0.2333, stats.density(), 1e-9);
    assertEquals(1.17, stats.averageDegree(), 1e-9);
    assertEquals(4, stats.maxDegree());
    assertEquals(0, stats.minDegree());
    assertEquals(4, stats.outDegrees().get("LHE"));
    assertEquals(3, stats.inDegrees().get("JFK"));
    assertEquals(0, stats.outDegrees().get("MID"));
  }

  @Test
  void density_shouldBeZeroBelowTwoVertices() {
    assertEquals(0.0, GraphAnalyzer.density(1, 0));
    assertEquals(0.0, GraphAnalyzer.density(0, 0));
    assertEquals(1.0, GraphAnalyzer.density(2, 2));
  }

  @Test
  void adjacencyList_shouldListOutgoingFlightsOfInvolvedAirports() {
    Map<String, List<AdjacencyEntry>> list = analyzer.adjacencyList(graph);

    assertEquals(List.of("DOH", "DXB", "IST", "JFK", "LHE"), List.copyOf(list.keySet()));
    assertEquals(4, list.get("LHE").size());
    assertTrue(list.get("JFK").isEmpty());
    assertFalse(list.containsKey("MID"), "Airports without flights are left out");
  }

  @Test
  void adjacencyMatrix_shouldHoldCheapestDirectFare() {
    AdjacencyMatrix matrix = analyzer.adjacencyMatrix(graph);

    assertEquals(6, matrix.airports().size());
    assertEquals(0, new BigDecimal("1500").compareTo(matrix.cell("LHE", "JFK")));
    assertEquals(0, BigDecimal.ZERO.compareTo(matrix.cell("JFK", "LHE")), "Direction matters");
    assertEquals(0, BigDecimal.ZERO.compareTo(matrix.cell("LHE", "LHE")));
  }

  @Test
  void adjacencyMatrix_shouldPickCheaperOfParallelFlights() {
    Flight cheaper = ExampleNetwork.flight("XX1", "Test", ExampleNetwork.LHE, ExampleNetwork.JFK, 700, 900);
    FlightGraph withParallel = FlightGraph.of(ExampleNetwork.airports(),
        List.of(ExampleNetwork.PK999, cheaper));

    AdjacencyMatrix matrix = analyzer.adjacencyMatrix(withParallel);

    assertEquals(0, new BigDecimal("900").compareTo(matrix.cell("LHE", "JFK")));
  }

  // ---------------------------------------------------------------------------
  // Connectivity
  // ---------------------------------------------------------------------------

  @Test
  void connectivity_shouldFindFewestHopPath() {
    ConnectivityResult result = analyzer.connectivity(graph, "LHE", "JFK");

    assertTrue(result.reachable());
    assertEquals(1, result.hops());
    assertEquals(List.of("LHE", "JFK"), result.path());
    assertEquals(List.of("DOH", "DXB", "IST", "JFK", "LHE"), result.reachableAirports());
  }

  /**
   * Edge case:
   * Reachability follows flight direction, so JFK reaches nothing.
   */
  @Test
  void connectivity_shouldReportUnreachableDestination() {
    ConnectivityResult result = analyzer.connectivity(graph, "JFK", "LHE");

    assertFalse(result.reachable());
    assertEquals(-1, result.hops());
    assertTrue(result.path().isEmpty());
    assertEquals(List.of("JFK"), result.reachableAirports());
  }

  @Test
  void connectivity_shouldRejectUnknownAirport() {
    assertThrows(UnknownAirportException.class, () -> analyzer.connectivity(graph, "LHE", "XXX"));
  }

  @Test
  void connectedComponents_shouldIgnoreDirectionAndSortLargestFirst() {
    ConnectedComponents components = analyzer.connectedComponents(graph);

    assertEquals(2, components.count());
    assertEquals(List.of("DOH", "DXB", "IST", "JFK", "LHE"), components.components().get(0));
    assertEquals(List.of("MID"), components.components().get(1));
    assertEquals(5, components.largestSize());
    assertFalse(components.isConnected());
  }

  @Test
  void weakComponent_shouldIncludeAirportsReachedAgainstFlightDirection() {
    assertEquals(List.of("DOH", "DXB", "IST", "JFK", "LHE"), analyzer.weakComponent(graph, "JFK"));
    assertEquals(List.of("MID"), analyzer.weakComponent(graph, "MID"));
  }

  // ---------------------------------------------------------------------------
  // Route subgraph
  // ---------------------------------------------------------------------------

  @Test
  void analyzeRoute_shouldCountPathsByLength() {
    RouteSubgraphAnalysis analysis = analyzer.analyzeRoute(graph, "LHE", "JFK", 3);

    assertEquals(4, analysis.totalPaths());
    assertEquals(1, analysis.directPaths());
    assertEquals(2, analysis.oneStopPaths());
    assertEquals(1, analysis.twoStopPaths());
    assertEquals(List.of("DOH", "DXB", "IST", "JFK", "LHE"), analysis.airports());
    assertEquals(7, analysis.edgeCount());
    assertEquals(4, analysis.sourceOutDegree());
    assertEquals(3, analysis.destinationInDegree());
    assertEquals(0.35, analysis.density(), 1e-9);
    assertTrue(analysis.isConnected());
  }

  @Test
  void analyzeRoute_shouldRespectHopLimit() {
    RouteSubgraphAnalysis analysis = analyzer.analyzeRoute(graph, "LHE", "JFK", 1);

    assertEquals(1, analysis.totalPaths());
    assertEquals(List.of("JFK", "LHE"), analysis.airports());
    assertEquals(List.of("PK999"), analysis.flights().stream().map(Flight::getFlightNumber).toList());
  }

  /**
   * Edge case:
   * Without any path the endpoints are still reported.
   */
  @Test
  void analyzeRoute_shouldKeepEndpointsWhenNoPathExists() {
    RouteSubgraphAnalysis analysis = analyzer.analyzeRoute(graph, "MID", "LHE", 3);

    assertEquals(0, analysis.totalPaths());
    assertEquals(List.of("LHE", "MID"), analysis.airports());
    assertTrue(analysis.flights().isEmpty());
    assertFalse(analysis.isConnected());
  }

  @Test
  void analyzeRoute_shouldRejectNonPositiveHopLimit() {
    assertThrows(IllegalArgumentException.class, () -> analyzer.analyzeRoute(graph, "LHE", "JFK", 0));
  }
}
