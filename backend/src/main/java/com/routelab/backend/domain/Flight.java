package com.routelab.backend.domain;

import com.routelab.backend.algorithms.graph.GreatCircle;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Directed edge of the flight graph. Several flights may connect the same
 * ordered pair of airports.
 */
public class Flight {

  private final String flightNumber;
  private final String airline;
  private final Airport origin;
  private final Airport destination;
  private final int durationMinutes;
  private final BigDecimal price;
  private final LocalTime departureTime;
  private final LocalTime arrivalTime;

  public Flight(String flightNumber,
      String airline,
      Airport origin,
      Airport destination,
      int durationMinutes,
      BigDecimal price,
      LocalTime departureTime,
      LocalTime arrivalTime) {

    this.flightNumber = Objects.requireNonNull(flightNumber, "flightNumber must not be null");
    this.airline = Objects.requireNonNull(airline, "airline must not be null");
    this.origin = Objects.requireNonNull(origin, "origin must not be null");
    this.destination = Objects.requireNonNull(destination, "destination must not be null");
    this.price = Objects.requireNonNull(price, "price must not be null");

    if (origin.getCode().equals(destination.getCode())) {
      throw new IllegalArgumentException("Flight " + flightNumber + " starts and ends at " + origin.getCode());
    }
    if (durationMinutes < 0) {
      throw new IllegalArgumentException("Flight " + flightNumber + " has negative duration " + durationMinutes);
    }
    if (price.signum() < 0) {
      throw new IllegalArgumentException("Flight " + flightNumber + " has negative price " + price);
    }

    this.durationMinutes = durationMinutes;
    // Optional schedule information, only used for display
    this.departureTime = departureTime;
    this.arrivalTime = arrivalTime;
  }

  /**
   * Convenience constructor for flights without schedule times.
   */
  public Flight(String flightNumber,
      String airline,
      Airport origin,
      Airport destination,
      int durationMinutes,
      BigDecimal price) {
    this(flightNumber, airline, origin, destination, durationMinutes, price, null, null);
  }

  public String getFlightNumber() {
    return flightNumber;
  }

  public String getAirline() {
    return airline;
  }

  public Airport getOrigin() {
    return origin;
  }

  public Airport getDestination() {
    return destination;
  }

  public String getOriginCode() {
    return origin.getCode();
  }

  public String getDestinationCode() {
    return destination.getCode();
  }

  public int getDurationMinutes() {
    return durationMinutes;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public Optional<LocalTime> getDepartureTime() {
    return Optional.ofNullable(departureTime);
  }

  public Optional<LocalTime> getArrivalTime() {
    return Optional.ofNullable(arrivalTime);
  }

  /**
   * Great-circle distance between the endpoints, computed on every call.
   */
  public double getDistanceKm() {
    return GreatCircle.distanceKm(origin, destination);
  }

  @Override
  public String toString() {
    return flightNumber + " " + origin.getCode() + "->" + destination.getCode();
  }
}
