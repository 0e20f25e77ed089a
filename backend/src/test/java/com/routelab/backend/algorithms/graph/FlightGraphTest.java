package com.routelab.backend.algorithms.graph;

import com.routelab.backend.domain.Airport;
import com.routelab.backend.domain.Flight;
import com.routelab.backend.exception.UnknownAirportException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.routelab.backend.ExampleNetwork.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FlightGraph} indexing and lookups.
 */
class FlightGraphTest {

  private final FlightGraph graph = graph();

  @Test
  void of_shouldIndexAirportsAndFlights() {
    assertEquals(6, graph.vertexCount());
    assertEquals(7, graph.edgeCount());
    assertEquals(List.of("DOH", "DXB", "IST", "JFK", "LHE", "MID"), graph.airportCodes());
  }

  @Test
  void outgoing_shouldBeOrderedByDestinationThenFlightNumber() {
    List<String> numbers = graph.outgoing("LHE").stream().map(Flight::getFlightNumber).toList();

    // DOH, DXB, IST, JFK
    assertEquals(List.of("QR201", "PK201", "TK101", "PK999"), numbers);
    assertEquals(List.of("DOH", "DXB", "IST", "JFK"), graph.successors("LHE"));
  }

  @Test
  void incoming_shouldListInboundFlightsByOrigin() {
    List<String> numbers = graph.incoming("JFK").stream().map(Flight::getFlightNumber).toList();

    assertEquals(List.of("QR501", "TK601", "PK999"), numbers);
    assertTrue(graph.incoming("MID").isEmpty());
    assertTrue(graph.outgoing("MID").isEmpty());
  }

  @Test
  void flightsBetween_shouldReturnParallelFlights() {
    Flight second = flight("PK203", "PIA", LHE, DXB, 160, 180);
    FlightGraph withParallel = FlightGraph.of(airports(), List.of(PK201, second, EK301));

    List<String> numbers = withParallel.flightsBetween("LHE", "DXB").stream()
        .map(Flight::getFlightNumber)
        .toList();

    assertEquals(List.of("PK201", "PK203"), numbers);
    assertEquals(List.of("DXB"), withParallel.successors("LHE"));
  }

  @Test
  void airport_shouldFailWithUnknownAirportException() {
    UnknownAirportException ex = assertThrows(UnknownAirportException.class, () -> graph.airport("XXX"));

    assertEquals("XXX", ex.getAirportCode());
    assertThrows(UnknownAirportException.class, () -> graph.requireEndpoints("LHE", "ZZZ"));
    assertFalse(graph.contains("ZZZ"));
  }

  /**
   * Failure case:
   * A flight whose endpoint is not among the airports cannot be part of the graph.
   */
  @Test
  void of_shouldRejectFlightsOutsideTheAirportSet() {
    List<Airport> withoutJfk = List.of(LHE, DXB, DOH);

    assertThrows(IllegalArgumentException.class, () -> FlightGraph.of(withoutJfk, List.of(PK999)));
  }
}
