package com.routelab.backend.service;

import com.routelab.backend.algorithms.pareto.RouteComparison;
import com.routelab.backend.domain.Route;

import java.util.List;

/**
 * Every simple route within {@code maxStops}, with the criteria comparison.
 */
public record RouteListing(List<Route> routes, RouteComparison comparison, int maxStops) {

  public RouteListing {
    routes = List.copyOf(routes);
  }
}
