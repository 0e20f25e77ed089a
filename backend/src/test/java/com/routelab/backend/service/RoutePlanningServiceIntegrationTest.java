package com.routelab.backend.service;

import com.routelab.backend.algorithms.analysis.GraphStatistics;
import com.routelab.backend.algorithms.analysis.RouteSubgraphAnalysis;
import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.algorithms.mst.MstAlgorithm;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.domain.Route;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that wires the real Spring context, loads the bundled
 * flights.json and checks end-to-end invariants of the query services:
 *  - every route is a connected chain from source to destination,
 *  - totals equal the sum of the legs,
 *  - each criterion's optimum is no worse than any listed route.
 */
@SpringBootTest
class RoutePlanningServiceIntegrationTest {

  @Autowired
  private RoutePlanningService routePlanningService;

  @Autowired
  private SimulationService simulationService;

  @Autowired
  private GraphAnalysisService graphAnalysisService;

  @Test
  @DisplayName("LHE→JFK: every listed route should be a consistent chain of legs")
  void findAllRoutes_LheToJfk_shouldReturnConsistentRoutes() {
    // when
    RouteListing listing = routePlanningService.findAllRoutes("LHE", "JFK", 2);

    // then
    assertEquals(36, listing.routes().size());
    for (Route route : listing.routes()) {
      List<Flight> legs = route.getLegs();
      assertEquals("LHE", route.getOriginCode());
      assertEquals("JFK", route.getDestinationCode());
      assertTrue(route.getNumberOfStops() <= 2);

      BigDecimal price = BigDecimal.ZERO;
      long minutes = 0;
      for (int i = 0; i < legs.size(); i++) {
        price = price.add(legs.get(i).getPrice());
        minutes += legs.get(i).getDurationMinutes();
        if (i > 0) {
          assertEquals(legs.get(i - 1).getDestinationCode(), legs.get(i).getOriginCode(), "Legs must connect");
        }
      }
      assertEquals(0, price.compareTo(route.getTotalPrice()));
      assertEquals(minutes, route.getTotalDurationMinutes());
      assertEquals(route.getPath().size(), route.getPath().stream().distinct().count(), "No airport repeats");
    }
  }

  @Test
  @DisplayName("LHE→JFK: single-criterion optima should beat every listed route")
  void findRoute_LheToJfk_shouldBeOptimalPerCriterion() {
    List<Route> all = routePlanningService.findAllRoutes("LHE", "JFK", 4).routes();

    Route cheapest = routePlanningService.findRoute("LHE", "JFK", OptimizationMode.CHEAPEST).orElseThrow();
    Route fastest = routePlanningService.findRoute("LHE", "JFK", OptimizationMode.FASTEST).orElseThrow();
    Route shortest = routePlanningService.findRoute("LHE", "JFK", OptimizationMode.SHORTEST).orElseThrow();

    assertEquals(0, new BigDecimal("600").compareTo(cheapest.getTotalPrice()));
    assertEquals(600, fastest.getTotalDurationMinutes());
    assertEquals(List.of("LHE", "JFK"), shortest.getPath());

    for (Route route : all) {
      assertTrue(cheapest.getTotalPrice().compareTo(route.getTotalPrice()) <= 0);
      assertTrue(fastest.getTotalDurationMinutes() <= route.getTotalDurationMinutes());
      assertTrue(shortest.getTotalDistanceKm() <= route.getTotalDistanceKm() + 1e-9);
    }
  }

  @Test
  @DisplayName("Airports without flights should be unreachable but known")
  void findRoute_toIsolatedAirport_shouldBeEmpty() {
    assertTrue(routePlanningService.findRoute("LHE", "FRA", OptimizationMode.CHEAPEST).isEmpty());
    assertTrue(routePlanningService.findParetoRoutes("MID", "JFK").isEmpty());
  }

  @Test
  @DisplayName("Graph statistics and route analysis should reflect the bundled dataset")
  void graphAnalysis_shouldReflectDataset() {
    GraphStatistics stats = graphAnalysisService.statistics();
    assertEquals(7, stats.vertices());
    assertEquals(17, stats.edges());
    assertEquals(0.4048, stats.density(), 1e-9);

    RouteSubgraphAnalysis analysis = graphAnalysisService.analyzeRoute("LHE", "JFK", 3);
    assertEquals(36, analysis.totalPaths());
    assertEquals(1, analysis.directPaths());
    assertEquals(8, analysis.oneStopPaths());
    assertEquals(27, analysis.twoStopPaths());
    assertEquals(5, analysis.vertexCount());
    assertEquals(17, analysis.edgeCount());
  }

  @Test
  @DisplayName("Prim and Kruskal should agree on the route-scope spanning tree weight")
  void simulateMst_shouldAgreeAcrossAlgorithms() {
    MstSimulation prim = simulationService.simulateMst("LHE", "JFK", MstAlgorithm.PRIM, null, null);
    MstSimulation kruskal = simulationService.simulateMst("LHE", "JFK", MstAlgorithm.KRUSKAL, null, null);

    assertEquals(0, new BigDecimal("950").compareTo(prim.result().totalWeight()));
    assertEquals(0, prim.result().totalWeight().compareTo(kruskal.result().totalWeight()));
    assertTrue(prim.result().isSpanning());
  }

  @Test
  @DisplayName("Array and heap strategies should agree on the bundled dataset")
  void comparePerformance_shouldAgreeAcrossStrategies() {
    for (OptimizationMode mode : OptimizationMode.values()) {
      assertTrue(simulationService.comparePerformance("LHE", "JFK", mode).sameTotals(), mode.name());
    }
  }
}
