package com.routelab.backend.service;

import com.routelab.backend.algorithms.RouteEnumerator;
import com.routelab.backend.algorithms.graph.CompositeWeights;
import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.algorithms.pareto.OverallRouteScorer;
import com.routelab.backend.algorithms.pareto.ParetoCandidateSet;
import com.routelab.backend.algorithms.pareto.ParetoRouteFinder;
import com.routelab.backend.algorithms.pareto.RouteComparison;
import com.routelab.backend.algorithms.shortestpath.HeapDijkstraEngine;
import com.routelab.backend.algorithms.shortestpath.SearchObserver;
import com.routelab.backend.algorithms.shortestpath.ShortestPathEngine;
import com.routelab.backend.domain.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Application service for route queries:
 *  - validates and normalizes airport codes and limits,
 *  - takes a fresh graph snapshot per query,
 *  - delegates to the heap-based engine, the route enumerator or the
 *    Pareto finder.
 *
 * "No route" is a normal outcome and is returned as an empty Optional or
 * an empty list; unknown airports raise UnknownAirportException.
 */
@Service
public class RoutePlanningService {

  private static final Logger log = LoggerFactory.getLogger(RoutePlanningService.class);

  private static final List<OptimizationMode> COMPARED_CRITERIA = List.of(
      OptimizationMode.CHEAPEST,
      OptimizationMode.FASTEST,
      OptimizationMode.SHORTEST
  );

  private final FlightGraphFactory graphFactory;
  private final ShortestPathEngine engine;
  private final RouteEnumerator routeEnumerator;
  private final ParetoRouteFinder paretoRouteFinder;
  private final OverallRouteScorer routeScorer;
  private final CompositeWeights compositeWeights;
  private final int defaultMaxStops;
  private final int maxStopsLimit;

  public RoutePlanningService(FlightGraphFactory graphFactory,
      HeapDijkstraEngine engine,
      RouteEnumerator routeEnumerator,
      ParetoRouteFinder paretoRouteFinder,
      OverallRouteScorer routeScorer,
      CompositeWeights compositeWeights,
      @Value("${routelab.search.default-max-stops:2}") int defaultMaxStops,
      @Value("${routelab.search.max-stops-limit:4}") int maxStopsLimit) {
    this.graphFactory = graphFactory;
    this.engine = engine;
    this.routeEnumerator = routeEnumerator;
    this.paretoRouteFinder = paretoRouteFinder;
    this.routeScorer = routeScorer;
    this.compositeWeights = compositeWeights;
    this.defaultMaxStops = defaultMaxStops;
    this.maxStopsLimit = maxStopsLimit;
  }

  /**
   * Optimal route for one criterion, or empty when the destination is unreachable.
   */
  public Optional<Route> findRoute(String source, String destination, OptimizationMode mode) {
    Objects.requireNonNull(mode, "mode must not be null");
    String sourceCode = QueryParameters.airportCode("source", source);
    String destinationCode = QueryParameters.airportCode("dest", destination);

    FlightGraph graph = graphFactory.snapshot();
    graph.requireEndpoints(sourceCode, destinationCode);

    Optional<Route> route = solve(graph, sourceCode, destinationCode, mode);
    log.info("Route {} {} -> {}: {}", mode.parameterName(), sourceCode, destinationCode,
        route.map(Route::toString).orElse("no route"));
    return route;
  }

  /**
   * Every simple route with at most {@code maxStops} stops, plus the
   * cheapest/fastest/shortest comparison.
   */
  public RouteListing findAllRoutes(String source, String destination, Integer maxStops) {
    String sourceCode = QueryParameters.airportCode("source", source);
    String destinationCode = QueryParameters.airportCode("dest", destination);
    int stops = QueryParameters.intInRange("max_stops", maxStops, defaultMaxStops, 0, maxStopsLimit);

    FlightGraph graph = graphFactory.snapshot();
    graph.requireEndpoints(sourceCode, destinationCode);

    List<Route> routes = routeEnumerator.enumerate(graph, sourceCode, destinationCode, stops);
    RouteComparison comparison = compare(graph, sourceCode, destinationCode);

    log.info("All routes {} -> {} within {} stops: {} found", sourceCode, destinationCode, stops, routes.size());
    return new RouteListing(routes, comparison, stops);
  }

  public ParetoCandidateSet findParetoRoutes(String source, String destination) {
    String sourceCode = QueryParameters.airportCode("source", source);
    String destinationCode = QueryParameters.airportCode("dest", destination);

    FlightGraph graph = graphFactory.snapshot();
    ParetoCandidateSet result = paretoRouteFinder.find(graph, sourceCode, destinationCode);

    log.info("Pareto {} -> {}: {} of {} candidates non-dominated",
        sourceCode, destinationCode, result.paretoCount(), result.candidateCount());
    return result;
  }

  // ---------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------

  private RouteComparison compare(FlightGraph graph, String sourceCode, String destinationCode) {
    Map<OptimizationMode, Route> optima = new EnumMap<>(OptimizationMode.class);
    for (OptimizationMode criterion : COMPARED_CRITERIA) {
      solve(graph, sourceCode, destinationCode, criterion)
          .ifPresent(route -> optima.put(criterion, route));
    }
    return routeScorer.compare(optima);
  }

  private Optional<Route> solve(FlightGraph graph, String sourceCode, String destinationCode, OptimizationMode mode) {
    return engine.search(
            graph.weighted(mode.weigher(graph, compositeWeights)),
            sourceCode,
            destinationCode,
            SearchObserver.NO_OP)
        .getRoute();
  }
}
