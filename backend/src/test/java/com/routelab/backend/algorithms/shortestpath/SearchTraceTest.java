package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.algorithms.graph.CompositeWeights;
import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.algorithms.graph.OptimizationMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.routelab.backend.ExampleNetwork.graph;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the snapshots recorded while Dijkstra runs.
 */
class SearchTraceTest {

  private final FlightGraph graph = graph();

  @Test
  void trace_shouldStartWithStartAndEndWithFinish() {
    ShortestPathResult result = new HeapDijkstraEngine()
        .solve(graph, "LHE", "JFK", OptimizationMode.CHEAPEST, 300);
    List<SearchState> trace = result.getTrace();

    assertFalse(result.isTraceTruncated());
    assertEquals(SearchStepKind.START, trace.get(0).kind());
    assertEquals(List.of(), trace.get(0).visited());

    SearchState last = trace.get(trace.size() - 1);
    assertEquals(SearchStepKind.FINISH, last.kind());
    assertEquals(List.of("LHE", "DXB", "DOH", "JFK"), last.routePath());

    for (int i = 0; i < trace.size(); i++) {
      assertEquals(i, trace.get(i).step());
    }
  }

  /**
   * Every relaxation attempt is recorded, improving or not, with its candidate cost.
   */
  @Test
  void trace_shouldRecordImprovingAndNonImprovingRelaxations() {
    List<SearchState> trace = new ArrayDijkstraEngine()
        .solve(graph, "LHE", "JFK", OptimizationMode.CHEAPEST, 300)
        .getTrace();

    List<Relaxation> relaxations = trace.stream()
        .filter(s -> s.kind() == SearchStepKind.RELAX)
        .map(SearchState::relaxation)
        .toList();

    // 4 from LHE, then EK301, QR501 and TK601
    assertEquals(7, relaxations.size());

    Relaxation viaIstanbul = relaxations.stream()
        .filter(r -> r.flightNumber().equals("TK601"))
        .findFirst()
        .orElseThrow();
    assertFalse(viaIstanbul.improved());
    assertEquals(1100.0, viaIstanbul.candidateCost(), 1e-9);
    assertNull(viaIstanbul.newCost());

    Relaxation viaDubai = relaxations.stream()
        .filter(r -> r.flightNumber().equals("EK301"))
        .findFirst()
        .orElseThrow();
    assertTrue(viaDubai.improved());
    assertEquals(350.0, viaDubai.newCost(), 1e-9);
  }

  /**
   * The heap strategy pushes DOH twice (450 via QR201, then 350 via EK301);
   * the outdated entry shows up as a stale pop. The array strategy has none.
   */
  @Test
  void heapTrace_shouldReportStaleEntries() {
    long heapStale = new HeapDijkstraEngine()
        .solve(graph, "LHE", "JFK", OptimizationMode.CHEAPEST, 300)
        .getTrace().stream()
        .filter(s -> s.kind() == SearchStepKind.STALE_ENTRY)
        .count();
    long arrayStale = new ArrayDijkstraEngine()
        .solve(graph, "LHE", "JFK", OptimizationMode.CHEAPEST, 300)
        .getTrace().stream()
        .filter(s -> s.kind() == SearchStepKind.STALE_ENTRY)
        .count();

    assertEquals(1, heapStale);
    assertEquals(0, arrayStale);
  }

  @Test
  void frontier_shouldBeOrderedByCost() {
    List<SearchState> trace = new HeapDijkstraEngine()
        .solve(graph, "LHE", "JFK", OptimizationMode.CHEAPEST, 300)
        .getTrace();

    for (SearchState state : trace) {
      List<FrontierEntry> frontier = state.frontier();
      for (int i = 1; i < frontier.size(); i++) {
        assertTrue(frontier.get(i - 1).cost() <= frontier.get(i).cost(),
            "Frontier out of order at step " + state.step());
      }
    }
  }

  /**
   * Lowering the cap truncates the trace but never changes the answer.
   */
  @Test
  void cappedTrace_shouldNotChangeTheRoute() {
    ShortestPathEngine engine = new HeapDijkstraEngine();
    ShortestPathResult full = engine.solve(graph, "LHE", "JFK", OptimizationMode.CHEAPEST, 300);
    ShortestPathResult capped = engine.solve(graph, "LHE", "JFK", OptimizationMode.CHEAPEST, 5);

    assertEquals(5, capped.getTrace().size());
    assertTrue(capped.isTraceTruncated());
    assertEquals(full.getRoute().orElseThrow().getPath(), capped.getRoute().orElseThrow().getPath());
    assertEquals(full.getDistances(), capped.getDistances());
  }

  @Test
  void search_withNoOpObserver_shouldHaveEmptyTrace() {
    ShortestPathEngine engine = new ArrayDijkstraEngine();
    ShortestPathResult result = engine.search(
        graph.weighted(OptimizationMode.CHEAPEST.weigher(graph, CompositeWeights.DEFAULT)),
        "LHE", "JFK", SearchObserver.NO_OP);

    assertTrue(result.getTrace().isEmpty());
    assertTrue(result.isFound());
    assertTrue(result.getOperations().getRelaxOps() > 0);
    assertEquals(0, result.getOperations().getHeapOps());
  }
}
