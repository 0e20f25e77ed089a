package com.routelab.backend.algorithms.pareto;

import com.routelab.backend.algorithms.RouteEnumerator;
import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.algorithms.shortestpath.HeapDijkstraEngine;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.domain.Route;
import com.routelab.backend.exception.UnknownAirportException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.routelab.backend.ExampleNetwork.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ParetoRouteFinder} and {@link RouteDominance}.
 */
class ParetoRouteFinderTest {

  private final FlightGraph graph = graph();

  private ParetoRouteFinder finder(boolean enumerate) {
    return new ParetoRouteFinder(new HeapDijkstraEngine(), new RouteEnumerator(500), enumerate, 2);
  }

  /**
   * The cheapest, fastest and shortest optima of the example network
   * trade off against each other, so all three survive.
   */
  @Test
  void find_shouldKeepAllThreeSingleCriterionOptima() {
    ParetoCandidateSet result = finder(false).find(graph, "LHE", "JFK");

    assertEquals(3, result.candidateCount());
    assertEquals(3, result.paretoCount());
    assertEquals(List.of("LHE->DXB->DOH->JFK", "LHE->DOH->JFK", "LHE->JFK"),
        result.paretoRoutes().stream().map(Route::toString).toList());
  }

  @Test
  void find_withEnumeration_shouldAddNonDominatedDetours() {
    ParetoCandidateSet result = finder(true).find(graph, "LHE", "JFK");

    // LHE->IST->JFK is neither cheaper, faster nor shorter than all three optima at once
    assertEquals(4, result.candidateCount());
    assertEquals(4, result.paretoCount());
    assertTrue(result.paretoRoutes().stream().anyMatch(r -> r.toString().equals("LHE->IST->JFK")));
  }

  @Test
  void find_shouldReturnEmptySetWhenUnreachable() {
    ParetoCandidateSet result = finder(false).find(graph, "MID", "JFK");

    assertTrue(result.isEmpty());
    assertEquals(0, result.candidateCount());
  }

  @Test
  void find_shouldRejectUnknownAirports() {
    assertThrows(UnknownAirportException.class, () -> finder(false).find(graph, "XXX", "JFK"));
  }

  /**
   * Antichain property: no route in the Pareto set dominates another.
   */
  @Test
  void paretoSet_shouldBeAnAntichain() {
    List<Route> pareto = finder(true).find(graph, "LHE", "JFK").paretoRoutes();

    for (Route a : pareto) {
      for (Route b : pareto) {
        assertFalse(RouteDominance.dominates(a, b), a + " dominates " + b);
      }
    }
  }

  @Test
  void nonDominated_shouldDropDominatedRoutes() {
    Flight pricierTwin = flight("XX201", "Test", LHE, DXB, 150, 260);
    Route cheap = Route.ofSingleLeg(PK201);
    Route pricey = Route.ofSingleLeg(pricierTwin);

    assertTrue(RouteDominance.dominates(cheap, pricey));
    assertFalse(RouteDominance.dominates(pricey, cheap));
    assertEquals(List.of(cheap), ParetoRouteFinder.nonDominated(List.of(pricey, cheap)));
  }

  @Test
  void dominates_shouldBeFalseForIdenticalTotals() {
    Route a = Route.ofSingleLeg(PK201);
    Route b = Route.ofSingleLeg(flight("XX202", "Test", LHE, DXB, 150, 200));

    assertFalse(RouteDominance.dominates(a, b));
    assertFalse(RouteDominance.dominates(b, a));
    assertEquals(2, ParetoRouteFinder.nonDominated(List.of(a, b)).size());
  }
}
