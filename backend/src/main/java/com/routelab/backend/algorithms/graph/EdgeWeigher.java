package com.routelab.backend.algorithms.graph;

import com.routelab.backend.domain.Flight;

/**
 * Maps a flight to the non-negative weight a solver minimizes.
 */
@FunctionalInterface
public interface EdgeWeigher {

  double weigh(Flight flight);
}
