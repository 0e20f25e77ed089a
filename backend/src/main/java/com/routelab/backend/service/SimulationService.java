package com.routelab.backend.service;

import com.routelab.backend.algorithms.analysis.GraphAnalyzer;
import com.routelab.backend.algorithms.analysis.RouteSubgraphAnalysis;
import com.routelab.backend.algorithms.graph.CompositeWeights;
import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.algorithms.graph.WeightedFlightGraph;
import com.routelab.backend.algorithms.mst.MstAlgorithm;
import com.routelab.backend.algorithms.mst.MstEngine;
import com.routelab.backend.algorithms.mst.MstResult;
import com.routelab.backend.algorithms.mst.MstScope;
import com.routelab.backend.algorithms.mst.UndirectedPriceGraph;
import com.routelab.backend.algorithms.shortestpath.DijkstraStrategy;
import com.routelab.backend.algorithms.shortestpath.SearchObserver;
import com.routelab.backend.algorithms.shortestpath.ShortestPathEngine;
import com.routelab.backend.algorithms.shortestpath.ShortestPathResult;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.exception.GraphInvariantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Step-by-step algorithm runs for visualization:
 *  - Dijkstra with a capped state trace, on either strategy;
 *  - array vs heap timing and operation counts on the same query;
 *  - Prim or Kruskal over a scoped, price-weighted undirected view.
 */
@Service
public class SimulationService {

  private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

  private final FlightGraphFactory graphFactory;
  private final Map<DijkstraStrategy, ShortestPathEngine> engines;
  private final MstEngine mstEngine;
  private final GraphAnalyzer graphAnalyzer;
  private final CompositeWeights compositeWeights;

  private final int defaultMaxStates;
  private final int maxStatesLimit;
  private final int defaultMstMaxStates;
  private final int mstMaxHops;
  private final MstScope defaultMstScope;

  public SimulationService(FlightGraphFactory graphFactory,
      List<ShortestPathEngine> shortestPathEngines,
      MstEngine mstEngine,
      GraphAnalyzer graphAnalyzer,
      CompositeWeights compositeWeights,
      @Value("${routelab.simulation.default-max-states:300}") int defaultMaxStates,
      @Value("${routelab.simulation.max-states-limit:5000}") int maxStatesLimit,
      @Value("${routelab.mst.default-max-states:500}") int defaultMstMaxStates,
      @Value("${routelab.mst.max-hops:3}") int mstMaxHops,
      @Value("${routelab.mst.scope:route}") String defaultMstScope) {
    this.graphFactory = graphFactory;
    this.mstEngine = mstEngine;
    this.graphAnalyzer = graphAnalyzer;
    this.compositeWeights = compositeWeights;
    this.defaultMaxStates = defaultMaxStates;
    this.maxStatesLimit = maxStatesLimit;
    this.defaultMstMaxStates = defaultMstMaxStates;
    this.mstMaxHops = mstMaxHops;
    this.defaultMstScope = MstScope.fromParameter(defaultMstScope);

    Map<DijkstraStrategy, ShortestPathEngine> byStrategy = new EnumMap<>(DijkstraStrategy.class);
    for (ShortestPathEngine engine : shortestPathEngines) {
      byStrategy.put(engine.strategy(), engine);
    }
    for (DijkstraStrategy strategy : DijkstraStrategy.values()) {
      if (!byStrategy.containsKey(strategy)) {
        throw new IllegalStateException("No shortest-path engine registered for " + strategy);
      }
    }
    this.engines = Collections.unmodifiableMap(byStrategy);
  }

  public ShortestPathResult simulateDijkstra(String source,
      String destination,
      OptimizationMode mode,
      DijkstraStrategy strategy,
      Integer maxStates) {
    Objects.requireNonNull(mode, "mode must not be null");
    Objects.requireNonNull(strategy, "strategy must not be null");
    String sourceCode = QueryParameters.airportCode("source", source);
    String destinationCode = QueryParameters.airportCode("dest", destination);
    int cap = QueryParameters.intInRange("max_states", maxStates, defaultMaxStates, 1, maxStatesLimit);

    FlightGraph graph = graphFactory.snapshot();
    ShortestPathResult result = engines.get(strategy)
        .solve(graph, sourceCode, destinationCode, mode, compositeWeights, cap);

    log.info("Dijkstra simulation ({}, {}) {} -> {}: found={}, states={}, truncated={}",
        strategy.parameterName(), mode.parameterName(), sourceCode, destinationCode,
        result.isFound(), result.getTrace().size(), result.isTraceTruncated());
    return result;
  }

  /**
   * Run both strategies without tracing and report time and operation counts.
   */
  public PerformanceComparison comparePerformance(String source, String destination, OptimizationMode mode) {
    Objects.requireNonNull(mode, "mode must not be null");
    String sourceCode = QueryParameters.airportCode("source", source);
    String destinationCode = QueryParameters.airportCode("dest", destination);

    FlightGraph graph = graphFactory.snapshot();
    graph.requireEndpoints(sourceCode, destinationCode);
    WeightedFlightGraph weighted = graph.weighted(mode.weigher(graph, compositeWeights));

    ShortestPathResult arrayBased = engines.get(DijkstraStrategy.ARRAY)
        .search(weighted, sourceCode, destinationCode, SearchObserver.NO_OP);
    ShortestPathResult heapBased = engines.get(DijkstraStrategy.HEAP)
        .search(weighted, sourceCode, destinationCode, SearchObserver.NO_OP);

    PerformanceComparison comparison = new PerformanceComparison(sourceCode, destinationCode, arrayBased, heapBased);
    if (!comparison.sameTotals()) {
      throw new GraphInvariantException("Dijkstra strategies disagree on " + sourceCode + " -> "
          + destinationCode + " (" + mode.parameterName() + "): array=" + arrayBased.getDistances()
          + ", heap=" + heapBased.getDistances());
    }
    log.info("Performance {} -> {} ({}): array={}ms heap={}ms speedup={}",
        sourceCode, destinationCode, mode.parameterName(),
        arrayBased.getElapsedMillis(), heapBased.getElapsedMillis(), comparison.speedup());
    return comparison;
  }

  /**
   * Minimum spanning tree over the airports selected by {@code scope};
   * null scope falls back to the configured default.
   */
  public MstSimulation simulateMst(String source,
      String destination,
      MstAlgorithm algorithm,
      Integer maxStates,
      MstScope scope) {
    Objects.requireNonNull(algorithm, "algorithm must not be null");
    String sourceCode = QueryParameters.airportCode("source", source);
    String destinationCode = QueryParameters.airportCode("dest", destination);
    int cap = QueryParameters.intInRange("max_states", maxStates, defaultMstMaxStates, 1, maxStatesLimit);
    MstScope effectiveScope = scope != null ? scope : defaultMstScope;

    FlightGraph graph = graphFactory.snapshot();
    graph.requireEndpoints(sourceCode, destinationCode);

    UndirectedPriceGraph scoped = scopedGraph(graph, sourceCode, destinationCode, effectiveScope);
    MstResult result = mstEngine.solve(scoped, algorithm, cap);

    log.info("MST ({}, {}) for {} -> {}: {} airports, {} edges, total {}",
        algorithm.parameterName(), effectiveScope.parameterName(), sourceCode, destinationCode,
        result.airports().size(), result.edges().size(), result.totalWeight());
    return new MstSimulation(sourceCode, destinationCode, effectiveScope, result);
  }

  private UndirectedPriceGraph scopedGraph(FlightGraph graph, String sourceCode, String destinationCode, MstScope scope) {
    if (scope == MstScope.COMPONENT) {
      List<String> component = graphAnalyzer.weakComponent(graph, sourceCode);
      return UndirectedPriceGraph.of(component, graph.flights(), sourceCode);
    }

    RouteSubgraphAnalysis subgraph = graphAnalyzer.analyzeRoute(graph, sourceCode, destinationCode, mstMaxHops);
    List<Flight> flights = subgraph.flights();
    return UndirectedPriceGraph.of(subgraph.airports(), flights, sourceCode);
  }
}
