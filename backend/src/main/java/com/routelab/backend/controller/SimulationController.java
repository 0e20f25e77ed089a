package com.routelab.backend.controller;

import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.algorithms.shortestpath.DijkstraStrategy;
import com.routelab.backend.algorithms.shortestpath.FrontierEntry;
import com.routelab.backend.algorithms.shortestpath.OperationCounters;
import com.routelab.backend.algorithms.shortestpath.Relaxation;
import com.routelab.backend.algorithms.shortestpath.SearchState;
import com.routelab.backend.algorithms.shortestpath.ShortestPathResult;
import com.routelab.backend.dto.DijkstraSimulationResponse;
import com.routelab.backend.dto.FrontierEntryResponse;
import com.routelab.backend.dto.OperationsResponse;
import com.routelab.backend.dto.PerformanceComparisonResponse;
import com.routelab.backend.dto.RelaxationResponse;
import com.routelab.backend.dto.SearchStateResponse;
import com.routelab.backend.dto.StrategyPerformanceResponse;
import com.routelab.backend.service.PerformanceComparison;
import com.routelab.backend.service.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Dijkstra traces and strategy comparison for the visualizer.
 */
@RestController
@RequestMapping("/api/simulate")
public class SimulationController {

  private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

  private final SimulationService simulationService;

  public SimulationController(SimulationService simulationService) {
    this.simulationService = simulationService;
  }

  /**
   * Example:
   *   GET /api/simulate/dijkstra?source=LHE&dest=JFK&mode=cheapest&max_states=300&strategy=heap
   */
  @GetMapping("/dijkstra")
  public DijkstraSimulationResponse dijkstra(
      @RequestParam(value = "source", required = false) String source,
      @RequestParam(value = "dest", required = false) String dest,
      @RequestParam(value = "mode", defaultValue = "cheapest") String mode,
      @RequestParam(value = "max_states", required = false) Integer maxStates,
      @RequestParam(value = "strategy", defaultValue = "heap") String strategy
  ) {
    OptimizationMode optimizationMode = OptimizationMode.fromParameter(mode);
    DijkstraStrategy dijkstraStrategy = DijkstraStrategy.fromParameter(strategy);
    log.info("Dijkstra simulation request: source={}, dest={}, mode={}, strategy={}, max_states={}",
        source, dest, optimizationMode.parameterName(), dijkstraStrategy.parameterName(), maxStates);

    ShortestPathResult result =
        simulationService.simulateDijkstra(source, dest, optimizationMode, dijkstraStrategy, maxStates);

    List<SearchStateResponse> states = result.getTrace().stream()
        .map(this::toStateResponse)
        .toList();

    return new DijkstraSimulationResponse(
        true,
        dijkstraStrategy.parameterName(),
        optimizationMode.parameterName(),
        RouteResponses.toResponse(result.getRoute().orElse(null)),
        states,
        states.size(),
        result.isTraceTruncated(),
        result.getDistances(),
        result.getCameFrom(),
        result.getVisitOrder(),
        toOperations(result.getOperations())
    );
  }

  @GetMapping("/compare-performance")
  public PerformanceComparisonResponse comparePerformance(
      @RequestParam(value = "source", required = false) String source,
      @RequestParam(value = "dest", required = false) String dest,
      @RequestParam(value = "mode", defaultValue = "cheapest") String mode
  ) {
    OptimizationMode optimizationMode = OptimizationMode.fromParameter(mode);
    log.info("Performance comparison request: source={}, dest={}, mode={}",
        source, dest, optimizationMode.parameterName());

    PerformanceComparison comparison = simulationService.comparePerformance(source, dest, optimizationMode);
    ShortestPathResult heap = comparison.heapBased();

    return new PerformanceComparisonResponse(
        true,
        comparison.source(),
        comparison.destination(),
        optimizationMode.parameterName(),
        toPerformance(comparison.arrayBased()),
        toPerformance(heap),
        new PerformanceComparisonResponse.Comparison(comparison.speedup(), comparison.sameTotals())
    );
  }

  // ---------------------------------------------------------------------------
  // Mapping
  // ---------------------------------------------------------------------------

  private SearchStateResponse toStateResponse(SearchState state) {
    List<FrontierEntryResponse> frontier = state.frontier().stream()
        .map(this::toFrontierEntry)
        .toList();

    return new SearchStateResponse(
        state.step(),
        state.kind().name().toLowerCase(Locale.ROOT),
        state.currentNode(),
        state.visited(),
        frontier,
        state.distances(),
        state.cameFrom(),
        toRelaxation(state.relaxation()),
        state.routePath()
    );
  }

  private FrontierEntryResponse toFrontierEntry(FrontierEntry entry) {
    return new FrontierEntryResponse(entry.node(), entry.cost());
  }

  private RelaxationResponse toRelaxation(Relaxation relaxation) {
    if (relaxation == null) {
      return null;
    }
    return new RelaxationResponse(
        relaxation.from(),
        relaxation.to(),
        relaxation.flightNumber(),
        relaxation.weight(),
        relaxation.candidateCost(),
        relaxation.improved(),
        relaxation.newCost()
    );
  }

  private StrategyPerformanceResponse toPerformance(ShortestPathResult result) {
    DijkstraStrategy strategy = result.getStrategy();
    return new StrategyPerformanceResponse(
        RouteResponses.round(result.getElapsedMillis(), 4),
        toOperations(result.getOperations()),
        result.isFound(),
        result.getVertexCount(),
        result.getEdgeCount(),
        strategy.timeComplexity(),
        strategy.spaceComplexity(),
        RouteResponses.toResponse(result.getRoute().orElse(null))
    );
  }

  private OperationsResponse toOperations(OperationCounters counters) {
    return new OperationsResponse(
        counters.getExtractMinOps(),
        counters.getRelaxOps(),
        counters.getComparisons(),
        counters.getHeapOps()
    );
  }
}
