package com.routelab.backend.algorithms;

import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.domain.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Exhaustive enumeration of simple routes between two airports.
 *
 * The search runs in two steps:
 *  - depth-first search over airport codes, never revisiting an airport,
 *    bounded by {@code maxStops + 1} legs;
 *  - expansion of every airport path into one route per combination of
 *    parallel flights on its legs.
 *
 * Results are ordered by stops, total duration, then total price.
 */
@Component
public class RouteEnumerator {

  private static final Logger log = LoggerFactory.getLogger(RouteEnumerator.class);

  private static final Comparator<Route> PRESENTATION_ORDER =
      Comparator.comparingInt(Route::getNumberOfStops)
          .thenComparingLong(Route::getTotalDurationMinutes)
          .thenComparing(Route::getTotalPrice)
          .thenComparing(Route::toString);

  /**
   * Upper bound on returned routes; dense graphs grow combinatorially.
   */
  private final int maxResults;

  public RouteEnumerator(@Value("${routelab.search.max-enumerated-routes:500}") int maxResults) {
    if (maxResults < 1) {
      throw new IllegalArgumentException("max-enumerated-routes must be positive: " + maxResults);
    }
    this.maxResults = maxResults;
  }

  public List<Route> enumerate(FlightGraph graph, String originCode, String destinationCode, int maxStops) {
    Objects.requireNonNull(graph, "graph must not be null");
    if (maxStops < 0) {
      throw new IllegalArgumentException("maxStops must not be negative: " + maxStops);
    }
    graph.requireEndpoints(originCode, destinationCode);

    if (originCode.equals(destinationCode)) {
      return List.of();
    }

    List<List<String>> airportPaths = findAirportPaths(graph, originCode, destinationCode, maxStops + 1);
    if (airportPaths.isEmpty()) {
      log.info("No airport paths found from {} to {} within {} stops", originCode, destinationCode, maxStops);
      return List.of();
    }

    List<Route> routes = new ArrayList<>();
    for (List<String> path : airportPaths) {
      expandPath(graph, path, 0, new ArrayDeque<>(), routes);
    }
    routes.sort(PRESENTATION_ORDER);

    if (routes.size() > maxResults) {
      log.warn("Enumerated {} routes from {} to {}, keeping the first {}",
          routes.size(), originCode, destinationCode, maxResults);
      return List.copyOf(routes.subList(0, maxResults));
    }
    return List.copyOf(routes);
  }

  // ---------------------------------------------------------------------------
  // Step 1: airport paths
  // ---------------------------------------------------------------------------

  private List<List<String>> findAirportPaths(FlightGraph graph,
      String originCode,
      String destinationCode,
      int maxLegs) {
    List<List<String>> result = new ArrayList<>();
    Deque<String> currentPath = new ArrayDeque<>();
    currentPath.add(originCode);

    dfsAirportPaths(graph, originCode, destinationCode, maxLegs, currentPath, result);
    return result;
  }

  private void dfsAirportPaths(FlightGraph graph,
      String current,
      String target,
      int remainingLegs,
      Deque<String> currentPath,
      List<List<String>> result) {

    if (current.equals(target)) {
      result.add(new ArrayList<>(currentPath));
      return;
    }

    if (remainingLegs == 0) {
      return;
    }

    for (String next : graph.successors(current)) {
      if (currentPath.contains(next)) {
        continue;
      }
      currentPath.addLast(next);
      dfsAirportPaths(graph, next, target, remainingLegs - 1, currentPath, result);
      currentPath.removeLast();
    }
  }

  // ---------------------------------------------------------------------------
  // Step 2: flight combinations along an airport path
  // ---------------------------------------------------------------------------

  private void expandPath(FlightGraph graph,
      List<String> airportPath,
      int legIndex,
      Deque<Flight> chosen,
      List<Route> accumulator) {
    if (legIndex == airportPath.size() - 1) {
      accumulator.add(new Route(new ArrayList<>(chosen)));
      return;
    }

    String from = airportPath.get(legIndex);
    String to = airportPath.get(legIndex + 1);
    for (Flight flight : graph.flightsBetween(from, to)) {
      chosen.addLast(flight);
      expandPath(graph, airportPath, legIndex + 1, chosen, accumulator);
      chosen.removeLast();
    }
  }
}
