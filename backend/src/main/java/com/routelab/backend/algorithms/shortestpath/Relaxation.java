package com.routelab.backend.algorithms.shortestpath;

/**
 * One attempt to improve the best-known cost of {@code to} through a flight.
 * {@code newCost} is null when the attempt did not improve anything.
 */
public record Relaxation(String from,
                         String to,
                         String flightNumber,
                         double weight,
                         double candidateCost,
                         boolean improved,
                         Double newCost) {

  static Relaxation of(String from, String to, String flightNumber, double weight,
      double candidateCost, boolean improved) {
    return new Relaxation(from, to, flightNumber, weight, candidateCost, improved,
        improved ? candidateCost : null);
  }
}
