package com.routelab.backend.algorithms.graph;

import com.routelab.backend.domain.Flight;

import java.util.List;

/**
 * Best-overall edge weight: price, duration and distance are each min-max
 * normalized over every flight of the graph, then blended with
 * {@link CompositeWeights}.
 */
public final class CompositeWeigher implements EdgeWeigher {

  private final CompositeWeights weights;
  private final Range price;
  private final Range duration;
  private final Range distance;

  private CompositeWeigher(CompositeWeights weights, Range price, Range duration, Range distance) {
    this.weights = weights;
    this.price = price;
    this.duration = duration;
    this.distance = distance;
  }

  public static CompositeWeigher forGraph(FlightGraph graph, CompositeWeights weights) {
    List<Flight> flights = graph.flights();
    return new CompositeWeigher(
        weights,
        Range.of(flights, f -> f.getPrice().doubleValue()),
        Range.of(flights, f -> f.getDurationMinutes()),
        Range.of(flights, Flight::getDistanceKm)
    );
  }

  @Override
  public double weigh(Flight flight) {
    return weights.price() * price.normalize(flight.getPrice().doubleValue())
        + weights.duration() * duration.normalize(flight.getDurationMinutes())
        + weights.distance() * distance.normalize(flight.getDistanceKm());
  }

  private record Range(double min, double span) {

    static Range of(List<Flight> flights, EdgeWeigher metric) {
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (Flight flight : flights) {
        double value = metric.weigh(flight);
        min = Math.min(min, value);
        max = Math.max(max, value);
      }
      if (flights.isEmpty()) {
        return new Range(0.0, 1.0);
      }
      double span = max - min;
      return new Range(min, span > 0.0 ? span : 1.0);
    }

    double normalize(double value) {
      return (value - min) / span;
    }
  }
}
