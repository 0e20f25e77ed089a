package com.routelab.backend.exception;

/**
 * A query referenced an airport code that is not part of the graph.
 * Mapped to HTTP 404 so callers can tell it apart from "no path".
 */
public class UnknownAirportException extends RuntimeException {

  private final String airportCode;

  public UnknownAirportException(String airportCode) {
    super("Unknown airport: " + airportCode);
    this.airportCode = airportCode;
  }

  public String getAirportCode() {
    return airportCode;
  }
}
