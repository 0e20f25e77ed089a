package com.routelab.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelab.backend.domain.Airport;
import com.routelab.backend.domain.Flight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only flight store. Flights whose airports are unknown, or whose
 * fields are malformed, are dropped at load time.
 */
@Component
public class FlightRepositoryInMemory {

  private static final Logger log = LoggerFactory.getLogger(FlightRepositoryInMemory.class);

  /**
   * Immutable list of all valid flights, in dataset order.
   */
  private final List<Flight> flights;

  public FlightRepositoryInMemory(NetworkDatasetLoader datasetLoader,
      ObjectMapper objectMapper,
      AirportRepositoryInMemory airportRepository,
      FlightJsonMapper flightJsonMapper) {

    Map<String, Airport> airportsByCode = airportRepository.asMap();
    this.flights = loadFlights(datasetLoader, objectMapper, flightJsonMapper, airportsByCode);

    long origins = flights.stream().map(Flight::getOriginCode).distinct().count();
    log.info("Loaded {} flights from {} across {} origin airports",
        flights.size(), datasetLoader.getLocation(), origins);
  }

  /**
   * Load and parse all flights from the dataset JSON, failing fast if the
   * document has no flights array or no valid flight at all.
   */
  private List<Flight> loadFlights(NetworkDatasetLoader loader,
      ObjectMapper objectMapper,
      FlightJsonMapper flightJsonMapper,
      Map<String, Airport> airportsByCode) {
    try (InputStream is = loader.openDatasetStream()) {
      JsonNode root = objectMapper.readTree(is);
      JsonNode flightsNode = root == null ? null : root.get("flights");

      if (flightsNode == null || !flightsNode.isArray()) {
        log.error("Dataset at {} has no 'flights' array", loader.getLocation());
        throw new IllegalStateException("Dataset missing 'flights' array");
      }

      List<Flight> result = new ArrayList<>();

      for (JsonNode node : flightsNode) {
        flightJsonMapper.toFlight(node, airportsByCode).ifPresent(result::add);
      }

      if (result.isEmpty()) {
        log.error("No valid flights could be loaded from {}", loader.getLocation());
        throw new IllegalStateException("No valid flights found in dataset");
      }

      return List.copyOf(result);

    } catch (IOException e) {
      throw new IllegalStateException("Failed to load flights from " + loader.getLocation(), e);
    }
  }

  public List<Flight> findAll() {
    return flights;
  }
}
