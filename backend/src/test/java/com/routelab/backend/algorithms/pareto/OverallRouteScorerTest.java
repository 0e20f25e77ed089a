package com.routelab.backend.algorithms.pareto;

import com.routelab.backend.algorithms.graph.CompositeWeights;
import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.domain.Route;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.routelab.backend.ExampleNetwork.*;
import static org.junit.jupiter.api.Assertions.*;

class OverallRouteScorerTest {

  private final OverallRouteScorer scorer = new OverallRouteScorer(CompositeWeights.DEFAULT);

  @Test
  void compare_shouldPickFastestOnExampleNetwork() {
    // given
    Map<OptimizationMode, Route> optima = new HashMap<>();
    optima.put(OptimizationMode.SHORTEST, Route.ofSingleLeg(PK999));
    optima.put(OptimizationMode.CHEAPEST, Route.ofLegs(PK201, EK301, QR501));
    optima.put(OptimizationMode.FASTEST, Route.ofLegs(QR201, QR501));

    // when
    RouteComparison comparison = scorer.compare(optima);

    // then
    assertEquals(OptimizationMode.FASTEST, comparison.bestCriterion());
    assertEquals("LHE->DOH->JFK", comparison.bestOverall().orElseThrow().toString());
    assertEquals(0.46875, comparison.scores().get(OptimizationMode.CHEAPEST), 1e-4);
    assertEquals(0.2899, comparison.scores().get(OptimizationMode.FASTEST), 1e-3);
    assertEquals(0.75, comparison.scores().get(OptimizationMode.SHORTEST), 1e-9);
  }

  /**
   * Edge case:
   * With one route every metric range is flat, so it scores 0.5 and wins.
   */
  @Test
  void compare_singleRoute_shouldScoreHalf() {
    RouteComparison comparison = scorer.compare(Map.of(OptimizationMode.CHEAPEST, Route.ofSingleLeg(PK201)));

    assertEquals(0.5, comparison.scores().get(OptimizationMode.CHEAPEST), 1e-12);
    assertEquals(OptimizationMode.CHEAPEST, comparison.bestCriterion());
  }

  @Test
  void compare_noRoutes_shouldHaveNoBest() {
    RouteComparison comparison = scorer.compare(Map.of());

    assertNull(comparison.bestCriterion());
    assertTrue(comparison.bestOverall().isEmpty());
    assertTrue(comparison.scores().isEmpty());
  }

  /**
   * Equal scores go to the criterion declared first.
   */
  @Test
  void compare_tiesShouldFollowDeclarationOrder() {
    Route same = Route.ofLegs(PK201, EK301, QR501);
    Map<OptimizationMode, Route> optima = new HashMap<>();
    optima.put(OptimizationMode.SHORTEST, same);
    optima.put(OptimizationMode.FASTEST, same);
    optima.put(OptimizationMode.CHEAPEST, same);

    assertEquals(OptimizationMode.CHEAPEST, scorer.compare(optima).bestCriterion());
  }
}
