package com.routelab.backend.algorithms.graph;

import com.routelab.backend.domain.Airport;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.exception.UnknownAirportException;

import java.util.*;

/**
 * Immutable directed multigraph of airports and flights, built once per
 * query from the record store.
 *
 * Responsibilities:
 *  - Index flights by origin and by destination airport.
 *  - Resolve airport codes, failing with UnknownAirportException.
 *  - Produce weighted views for a given {@link EdgeWeigher}.
 *
 * Outgoing and incoming flight lists are ordered by the opposite endpoint's
 * code, then flight number, so every traversal is deterministic.
 */
public final class FlightGraph {

  private static final Comparator<Flight> BY_DESTINATION =
      Comparator.comparing(Flight::getDestinationCode).thenComparing(Flight::getFlightNumber);

  private static final Comparator<Flight> BY_ORIGIN =
      Comparator.comparing(Flight::getOriginCode).thenComparing(Flight::getFlightNumber);

  /**
   * code -> airport, sorted by code.
   */
  private final SortedMap<String, Airport> airportsByCode;

  private final List<Flight> flights;

  private final Map<String, List<Flight>> outgoing;

  private final Map<String, List<Flight>> incoming;

  private FlightGraph(SortedMap<String, Airport> airportsByCode, List<Flight> flights) {
    this.airportsByCode = Collections.unmodifiableSortedMap(airportsByCode);
    this.flights = List.copyOf(flights);
    this.outgoing = groupFlights(flights, true);
    this.incoming = groupFlights(flights, false);
  }

  public static FlightGraph of(Collection<Airport> airports, Collection<Flight> flights) {
    Objects.requireNonNull(airports, "airports must not be null");
    Objects.requireNonNull(flights, "flights must not be null");

    SortedMap<String, Airport> byCode = new TreeMap<>();
    for (Airport airport : airports) {
      byCode.put(airport.getCode(), airport);
    }

    for (Flight flight : flights) {
      if (!byCode.containsKey(flight.getOriginCode()) || !byCode.containsKey(flight.getDestinationCode())) {
        throw new IllegalArgumentException("Flight " + flight + " references an airport outside the graph");
      }
    }

    return new FlightGraph(byCode, new ArrayList<>(flights));
  }

  // ---------------------------------------------------------------------------
  // Indexing
  // ---------------------------------------------------------------------------

  private Map<String, List<Flight>> groupFlights(List<Flight> flights, boolean byOrigin) {
    Map<String, List<Flight>> grouped = new HashMap<>();

    for (Flight flight : flights) {
      String key = byOrigin ? flight.getOriginCode() : flight.getDestinationCode();
      grouped
          .computeIfAbsent(key, k -> new ArrayList<>())
          .add(flight);
    }

    Map<String, List<Flight>> result = new HashMap<>();
    for (Map.Entry<String, List<Flight>> entry : grouped.entrySet()) {
      List<Flight> sorted = new ArrayList<>(entry.getValue());
      sorted.sort(byOrigin ? BY_DESTINATION : BY_ORIGIN);
      result.put(entry.getKey(), List.copyOf(sorted));
    }
    return Collections.unmodifiableMap(result);
  }

  // ---------------------------------------------------------------------------
  // Public API
  // ---------------------------------------------------------------------------

  public Airport airport(String code) {
    Airport airport = airportsByCode.get(code);
    if (airport == null) {
      throw new UnknownAirportException(code);
    }
    return airport;
  }

  public boolean contains(String code) {
    return airportsByCode.containsKey(code);
  }

  /**
   * Check both endpoints of a query exist in the graph.
   */
  public void requireEndpoints(String sourceCode, String destinationCode) {
    airport(sourceCode);
    airport(destinationCode);
  }

  /**
   * All airport codes, sorted ascending.
   */
  public List<String> airportCodes() {
    return List.copyOf(airportsByCode.keySet());
  }

  public Collection<Airport> airports() {
    return airportsByCode.values();
  }

  public List<Flight> flights() {
    return flights;
  }

  public List<Flight> outgoing(String code) {
    return outgoing.getOrDefault(code, List.of());
  }

  /**
   * Parallel flights from origin to destination, ordered by flight number.
   */
  public List<Flight> flightsBetween(String originCode, String destinationCode) {
    return outgoing(originCode).stream()
        .filter(f -> f.getDestinationCode().equals(destinationCode))
        .toList();
  }

  /**
   * Distinct destination codes reachable by one flight, sorted.
   */
  public List<String> successors(String code) {
    return outgoing(code).stream()
        .map(Flight::getDestinationCode)
        .distinct()
        .toList();
  }

  public List<Flight> incoming(String code) {
    return incoming.getOrDefault(code, List.of());
  }

  public int vertexCount() {
    return airportsByCode.size();
  }

  public int edgeCount() {
    return flights.size();
  }

  public WeightedFlightGraph weighted(EdgeWeigher weigher) {
    return new WeightedFlightGraph(this, weigher);
  }
}
