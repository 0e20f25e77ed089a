package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.algorithms.graph.WeightedFlightGraph;
import com.routelab.backend.domain.Airport;
import com.routelab.backend.domain.Flight;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Array- and heap-based Dijkstra must agree on distances, parent pointers
 * and routes for every non-negative graph, including graphs full of
 * equal-cost ties and parallel flights.
 */
class DijkstraStrategyEquivalenceTest {

  private static final int GRAPHS = 60;

  @Test
  void strategies_shouldAgreeOnRandomGraphs() {
    Random random = new Random(20240515L);
    ShortestPathEngine array = new ArrayDijkstraEngine();
    ShortestPathEngine heap = new HeapDijkstraEngine();

    for (int g = 0; g < GRAPHS; g++) {
      FlightGraph graph = randomGraph(random, 4 + random.nextInt(9), random.nextInt(40));
      // a small price range forces plenty of ties
      WeightedFlightGraph weighted = graph.weighted(f -> f.getPrice().doubleValue());
      List<String> codes = graph.airportCodes();

      for (int q = 0; q < 5; q++) {
        String source = codes.get(random.nextInt(codes.size()));
        String destination = codes.get(random.nextInt(codes.size()));

        ShortestPathResult a = array.search(weighted, source, destination, SearchObserver.NO_OP);
        ShortestPathResult h = heap.search(weighted, source, destination, SearchObserver.NO_OP);

        String query = "graph " + g + " " + source + " -> " + destination;
        assertEquals(a.getDistances(), h.getDistances(), query);
        assertEquals(a.getCameFrom(), h.getCameFrom(), query);
        assertEquals(a.getVisitOrder(), h.getVisitOrder(), query);
        assertEquals(a.isFound(), h.isFound(), query);
        if (a.isFound()) {
          assertEquals(a.getRoute().orElseThrow().getLegs(), h.getRoute().orElseThrow().getLegs(), query);
          assertEquals(a.getDistances().get(destination),
              a.getRoute().orElseThrow().getTotalPrice().doubleValue(), 1e-9, query);
        }
      }
    }
  }

  @Test
  void operationCounters_shouldReflectStrategy() {
    Random random = new Random(7L);
    FlightGraph graph = randomGraph(random, 10, 30);
    WeightedFlightGraph weighted = graph.weighted(f -> f.getPrice().doubleValue());
    String source = graph.airportCodes().get(0);
    String destination = graph.airportCodes().get(9);

    ShortestPathResult array = new ArrayDijkstraEngine().search(weighted, source, destination, SearchObserver.NO_OP);
    ShortestPathResult heap = new HeapDijkstraEngine().search(weighted, source, destination, SearchObserver.NO_OP);

    assertEquals(DijkstraStrategy.ARRAY, array.getStrategy());
    assertEquals(DijkstraStrategy.HEAP, heap.getStrategy());
    assertEquals(0, array.getOperations().getHeapOps());
    assertTrue(heap.getOperations().getHeapOps() > 0);
    assertEquals(array.getOperations().getRelaxOps(), heap.getOperations().getRelaxOps());
  }

  private static FlightGraph randomGraph(Random random, int airportCount, int flightCount) {
    List<Airport> airports = new ArrayList<>();
    for (int i = 0; i < airportCount; i++) {
      airports.add(new Airport(
          "A" + (char) ('A' + i) + (char) ('A' + random.nextInt(26)),
          "Airport " + i, "City " + i, "Country",
          random.nextDouble() * 120.0 - 60.0,
          random.nextDouble() * 340.0 - 170.0));
    }

    List<Flight> flights = new ArrayList<>();
    for (int i = 0; i < flightCount; i++) {
      Airport from = airports.get(random.nextInt(airportCount));
      Airport to = airports.get(random.nextInt(airportCount));
      if (from.equals(to)) {
        continue;
      }
      flights.add(new Flight("RF" + i, "Random Air", from, to,
          30 + random.nextInt(600), BigDecimal.valueOf(random.nextInt(6) * 50L)));
    }
    return FlightGraph.of(airports, flights);
  }
}
