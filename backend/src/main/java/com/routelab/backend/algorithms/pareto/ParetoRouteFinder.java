package com.routelab.backend.algorithms.pareto;

import com.routelab.backend.algorithms.RouteEnumerator;
import com.routelab.backend.algorithms.graph.CompositeWeights;
import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.algorithms.shortestpath.HeapDijkstraEngine;
import com.routelab.backend.algorithms.shortestpath.SearchObserver;
import com.routelab.backend.algorithms.shortestpath.ShortestPathEngine;
import com.routelab.backend.domain.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Multi-criteria route search.
 *
 * Candidates are the single-criterion optima for price, duration and
 * distance, optionally widened with every simple route up to a stop limit.
 * Candidates sharing an airport path collapse into one entry; the result
 * keeps each candidate that no other candidate dominates.
 */
@Component
public class ParetoRouteFinder {

  private static final Logger log = LoggerFactory.getLogger(ParetoRouteFinder.class);

  static final List<OptimizationMode> CRITERIA = List.of(
      OptimizationMode.CHEAPEST,
      OptimizationMode.FASTEST,
      OptimizationMode.SHORTEST
  );

  private final ShortestPathEngine engine;
  private final RouteEnumerator enumerator;
  private final boolean enumerateCandidates;
  private final int enumerationMaxStops;

  @Autowired
  public ParetoRouteFinder(HeapDijkstraEngine engine,
      RouteEnumerator enumerator,
      @Value("${routelab.pareto.enumerate-candidates:false}") boolean enumerateCandidates,
      @Value("${routelab.pareto.enumeration-max-stops:2}") int enumerationMaxStops) {
    this((ShortestPathEngine) engine, enumerator, enumerateCandidates, enumerationMaxStops);
  }

  ParetoRouteFinder(ShortestPathEngine engine,
      RouteEnumerator enumerator,
      boolean enumerateCandidates,
      int enumerationMaxStops) {
    this.engine = Objects.requireNonNull(engine, "engine must not be null");
    this.enumerator = Objects.requireNonNull(enumerator, "enumerator must not be null");
    this.enumerateCandidates = enumerateCandidates;
    this.enumerationMaxStops = enumerationMaxStops;
  }

  public ParetoCandidateSet find(FlightGraph graph, String sourceCode, String destinationCode) {
    Objects.requireNonNull(graph, "graph must not be null");
    graph.requireEndpoints(sourceCode, destinationCode);

    Map<List<String>, Route> byPath = new LinkedHashMap<>();

    for (OptimizationMode criterion : CRITERIA) {
      engine.search(
              graph.weighted(criterion.weigher(graph, CompositeWeights.DEFAULT)),
              sourceCode,
              destinationCode,
              SearchObserver.NO_OP)
          .getRoute()
          .ifPresent(route -> addCandidate(byPath, route));
    }

    if (enumerateCandidates) {
      enumerator.enumerate(graph, sourceCode, destinationCode, enumerationMaxStops)
          .forEach(route -> addCandidate(byPath, route));
    }

    List<Route> candidates = new ArrayList<>(byPath.values());
    List<Route> pareto = nonDominated(candidates);

    log.debug("Pareto {} -> {}: {} candidates, {} non-dominated",
        sourceCode, destinationCode, candidates.size(), pareto.size());

    return new ParetoCandidateSet(pareto, candidates);
  }

  /**
   * Keep the first route seen for a path unless a newcomer on the same path
   * dominates it.
   */
  private void addCandidate(Map<List<String>, Route> byPath, Route route) {
    Route existing = byPath.get(route.getPath());
    if (existing == null || RouteDominance.dominates(route, existing)) {
      byPath.put(route.getPath(), route);
    }
  }

  static List<Route> nonDominated(List<Route> candidates) {
    List<Route> result = new ArrayList<>();
    for (Route candidate : candidates) {
      boolean dominated = false;
      for (Route other : candidates) {
        if (other != candidate && RouteDominance.dominates(other, candidate)) {
          dominated = true;
          break;
        }
      }
      if (!dominated) {
        result.add(candidate);
      }
    }
    return result;
  }
}
