package com.routelab.backend.controller;

import com.routelab.backend.domain.Airport;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.domain.Route;
import com.routelab.backend.dto.CoordinateResponse;
import com.routelab.backend.dto.LegResponse;
import com.routelab.backend.dto.RouteResponse;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Mapping from domain Route/Flight to the API models shared by several controllers.
 */
final class RouteResponses {

  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

  private RouteResponses() {
  }

  static RouteResponse toResponse(Route route) {
    if (route == null) {
      return null;
    }
    List<LegResponse> legs = route.getLegs().stream()
        .map(RouteResponses::toLegResponse)
        .toList();

    return new RouteResponse(
        route.getPath(),
        legs,
        route.getNumberOfStops(),
        route.getTotalPrice(),
        route.getTotalDurationMinutes(),
        round(route.getTotalDistanceKm(), 2),
        coordinates(route)
    );
  }

  static List<RouteResponse> toResponses(List<Route> routes) {
    return routes.stream()
        .map(RouteResponses::toResponse)
        .toList();
  }

  static LegResponse toLegResponse(Flight flight) {
    return new LegResponse(
        flight.getFlightNumber(),
        flight.getAirline(),
        flight.getOriginCode(),
        flight.getDestinationCode(),
        flight.getDepartureTime().map(RouteResponses::formatTime).orElse(null),
        flight.getArrivalTime().map(RouteResponses::formatTime).orElse(null),
        flight.getDurationMinutes(),
        flight.getPrice(),
        round(flight.getDistanceKm(), 2)
    );
  }

  static double round(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }

  private static List<CoordinateResponse> coordinates(Route route) {
    List<Flight> legs = route.getLegs();
    List<CoordinateResponse> result = new ArrayList<>(legs.size() + 1);
    result.add(toCoordinate(legs.get(0).getOrigin()));
    for (Flight leg : legs) {
      result.add(toCoordinate(leg.getDestination()));
    }
    return result;
  }

  private static CoordinateResponse toCoordinate(Airport airport) {
    return new CoordinateResponse(airport.getCode(), airport.getLatitude(), airport.getLongitude());
  }

  private static String formatTime(LocalTime time) {
    return time.format(HH_MM);
  }
}
