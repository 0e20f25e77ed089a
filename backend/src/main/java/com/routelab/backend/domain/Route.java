package com.routelab.backend.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable value object representing a routed itinerary:
 * one or more flight legs, chained origin to destination.
 * A query without a route is represented by an empty Optional,
 * never by a Route with zero legs.
 */
public final class Route {

  private final List<Flight> legs;
  private final List<String> path;

  public Route(List<Flight> legs) {
    Objects.requireNonNull(legs, "legs must not be null");
    if (legs.isEmpty()) {
      throw new IllegalArgumentException("Route must contain at least one flight leg");
    }

    List<String> codes = new ArrayList<>(legs.size() + 1);
    codes.add(legs.get(0).getOriginCode());
    for (int i = 0; i < legs.size(); i++) {
      Flight leg = legs.get(i);
      if (i > 0 && !legs.get(i - 1).getDestinationCode().equals(leg.getOriginCode())) {
        throw new IllegalArgumentException(
            "Leg " + leg + " does not depart from " + legs.get(i - 1).getDestinationCode());
      }
      codes.add(leg.getDestinationCode());
    }

    this.legs = List.copyOf(legs);
    this.path = List.copyOf(codes);
  }

  /**
   * Legs in order from origin to final destination.
   */
  public List<Flight> getLegs() {
    return legs;
  }

  /**
   * Airport codes visited, origin first.
   */
  public List<String> getPath() {
    return path;
  }

  public String getOriginCode() {
    return path.get(0);
  }

  public String getDestinationCode() {
    return path.get(path.size() - 1);
  }

  /**
   * Number of stops = path length - 2.
   */
  public int getNumberOfStops() {
    return path.size() - 2;
  }

  public BigDecimal getTotalPrice() {
    BigDecimal total = BigDecimal.ZERO;
    for (Flight flight : legs) {
      total = total.add(flight.getPrice());
    }
    return total;
  }

  public long getTotalDurationMinutes() {
    long total = 0;
    for (Flight flight : legs) {
      total += flight.getDurationMinutes();
    }
    return total;
  }

  public double getTotalDistanceKm() {
    double total = 0.0;
    for (Flight flight : legs) {
      total += flight.getDistanceKm();
    }
    return total;
  }

  public static Route ofSingleLeg(Flight flight) {
    return new Route(Collections.singletonList(flight));
  }

  public static Route ofLegs(Flight... flights) {
    List<Flight> list = new ArrayList<>(flights.length);
    Collections.addAll(list, flights);
    return new Route(list);
  }

  @Override
  public String toString() {
    return String.join("->", path);
  }
}
