package com.routelab.backend.algorithms.pareto;

import com.routelab.backend.domain.Route;

import java.util.List;

/**
 * Non-dominated routes together with every candidate they were chosen from.
 */
public record ParetoCandidateSet(List<Route> paretoRoutes, List<Route> candidates) {

  public ParetoCandidateSet {
    paretoRoutes = List.copyOf(paretoRoutes);
    candidates = List.copyOf(candidates);
  }

  public int paretoCount() {
    return paretoRoutes.size();
  }

  public int candidateCount() {
    return candidates.size();
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }
}
