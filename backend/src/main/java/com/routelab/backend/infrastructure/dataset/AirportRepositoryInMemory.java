package com.routelab.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelab.backend.domain.Airport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Read-only airport store, loaded once from the network dataset.
 */
@Component
public class AirportRepositoryInMemory {

  private static final Logger log = LoggerFactory.getLogger(AirportRepositoryInMemory.class);

  private final Map<String, Airport> airportsByCode;

  public AirportRepositoryInMemory(NetworkDatasetLoader datasetLoader,
      ObjectMapper objectMapper,
      AirportJsonMapper airportJsonMapper) {
    this.airportsByCode = loadAirports(datasetLoader, objectMapper, airportJsonMapper);
    log.info("Loaded {} airports from {}", airportsByCode.size(), datasetLoader.getLocation());
  }

  private Map<String, Airport> loadAirports(NetworkDatasetLoader loader,
      ObjectMapper objectMapper,
      AirportJsonMapper airportJsonMapper) {
    try (InputStream is = loader.openDatasetStream()) {
      JsonNode root = objectMapper.readTree(is);
      JsonNode airportsNode = root == null ? null : root.get("airports");

      if (airportsNode == null || !airportsNode.isArray()) {
        log.error("Dataset at {} has no 'airports' array", loader.getLocation());
        throw new IllegalStateException("Dataset missing 'airports' array");
      }

      Map<String, Airport> result = new TreeMap<>();

      for (JsonNode node : airportsNode) {
        airportJsonMapper.toAirport(node).ifPresent(airport -> {
          Airport previous = result.putIfAbsent(airport.getCode(), airport);
          if (previous != null) {
            log.warn("Skipping duplicate airport code {}", airport.getCode());
          }
        });
      }

      if (result.isEmpty()) {
        log.error("No valid airports could be loaded from {}", loader.getLocation());
        throw new IllegalStateException("No valid airports found in dataset");
      }

      return Collections.unmodifiableMap(result);

    } catch (IOException e) {
      throw new IllegalStateException("Failed to load airports from " + loader.getLocation(), e);
    }
  }

  // ---------------------------------------------------------------------------
  // Public API
  // ---------------------------------------------------------------------------

  public Optional<Airport> findByCode(String code) {
    return Optional.ofNullable(airportsByCode.get(code));
  }

  /**
   * All airports, ordered by code.
   */
  public Collection<Airport> findAll() {
    return airportsByCode.values();
  }

  public Map<String, Airport> asMap() {
    return airportsByCode;
  }
}
