package com.routelab.backend.controller;

import com.routelab.backend.algorithms.graph.OptimizationMode;
import com.routelab.backend.algorithms.pareto.ParetoCandidateSet;
import com.routelab.backend.algorithms.pareto.RouteComparison;
import com.routelab.backend.domain.Route;
import com.routelab.backend.dto.AlgorithmResultsResponse;
import com.routelab.backend.dto.ParetoResponse;
import com.routelab.backend.dto.RouteSearchResponse;
import com.routelab.backend.service.RouteListing;
import com.routelab.backend.service.RoutePlanningService;
import com.routelab.backend.service.RouteQueryMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for route planning.
 *
 *  - GET /api/routes/find
 *      - source, dest: airport codes
 *      - optimization: cheapest | fastest | shortest | best_overall | all | pareto (default all)
 *      - max_stops: 0-4, only used by "all" (default 2)
 *  - GET /api/routes/pareto
 *      - source, dest: airport codes
 *      - same body as /find with optimization=pareto
 *
 * "No route" is answered with 200 and success=false; unknown airports with 404.
 */
@RestController
@RequestMapping("/api/routes")
public class RouteController {

  private static final Logger log = LoggerFactory.getLogger(RouteController.class);

  private final RoutePlanningService routePlanningService;

  public RouteController(RoutePlanningService routePlanningService) {
    this.routePlanningService = routePlanningService;
  }

  /**
   * Example:
   *   GET /api/routes/find?source=LHE&dest=JFK&optimization=cheapest
   */
  @GetMapping("/find")
  public ResponseEntity<?> find(
      @RequestParam(value = "source", required = false) String source,
      @RequestParam(value = "dest", required = false) String dest,
      @RequestParam(value = "optimization", defaultValue = "all") String optimization,
      @RequestParam(value = "max_stops", required = false) Integer maxStops
  ) {
    RouteQueryMode queryMode = RouteQueryMode.fromParameter(optimization);
    log.info("Route request: source={}, dest={}, optimization={}, max_stops={}",
        source, dest, queryMode.parameterName(), maxStops);

    if (queryMode == RouteQueryMode.PARETO) {
      return ResponseEntity.ok(paretoResponse(source, dest));
    }

    Optional<OptimizationMode> criterion = queryMode.optimization();
    if (criterion.isEmpty()) {
      RouteListing listing = routePlanningService.findAllRoutes(source, dest, maxStops);
      return ResponseEntity.ok(RouteSearchResponse.listing(
          RouteResponses.toResponses(listing.routes()),
          listing.maxStops(),
          toAlgorithmResults(listing.comparison())
      ));
    }

    Optional<Route> route = routePlanningService.findRoute(source, dest, criterion.get());
    return ResponseEntity.ok(route
        .map(r -> RouteSearchResponse.single(queryMode.parameterName(), RouteResponses.toResponse(r)))
        .orElseGet(() -> RouteSearchResponse.noRoute(queryMode.parameterName(), "No route found")));
  }

  @GetMapping("/pareto")
  public ParetoResponse pareto(
      @RequestParam(value = "source", required = false) String source,
      @RequestParam(value = "dest", required = false) String dest
  ) {
    log.info("Pareto request: source={}, dest={}", source, dest);
    return paretoResponse(source, dest);
  }

  // ---------------------------------------------------------------------------
  // Mapping
  // ---------------------------------------------------------------------------

  private ParetoResponse paretoResponse(String source, String dest) {
    ParetoCandidateSet result = routePlanningService.findParetoRoutes(source, dest);
    return new ParetoResponse(
        !result.isEmpty(),
        RouteResponses.toResponses(result.paretoRoutes()),
        RouteResponses.toResponses(result.candidates()),
        result.paretoCount(),
        result.candidateCount(),
        "pareto_optimal",
        result.isEmpty() ? "No Pareto optimal routes found" : null
    );
  }

  private AlgorithmResultsResponse toAlgorithmResults(RouteComparison comparison) {
    Map<OptimizationMode, Route> optima = comparison.optima();

    Map<String, Double> scores = new LinkedHashMap<>();
    comparison.scores().forEach((mode, score) -> scores.put(mode.parameterName(), RouteResponses.round(score, 4)));

    return new AlgorithmResultsResponse(
        RouteResponses.toResponse(optima.get(OptimizationMode.CHEAPEST)),
        RouteResponses.toResponse(optima.get(OptimizationMode.FASTEST)),
        RouteResponses.toResponse(optima.get(OptimizationMode.SHORTEST)),
        RouteResponses.toResponse(comparison.bestOverall().orElse(null)),
        comparison.bestCriterion() == null ? null : comparison.bestCriterion().parameterName(),
        scores
    );
  }
}
