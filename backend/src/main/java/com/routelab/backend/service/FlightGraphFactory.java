package com.routelab.backend.service;

import com.routelab.backend.algorithms.graph.FlightGraph;
import com.routelab.backend.infrastructure.dataset.AirportRepositoryInMemory;
import com.routelab.backend.infrastructure.dataset.FlightRepositoryInMemory;
import org.springframework.stereotype.Component;

/**
 * Builds the per-query graph snapshot from the record store.
 */
@Component
public class FlightGraphFactory {

  private final AirportRepositoryInMemory airportRepository;
  private final FlightRepositoryInMemory flightRepository;

  public FlightGraphFactory(AirportRepositoryInMemory airportRepository,
      FlightRepositoryInMemory flightRepository) {
    this.airportRepository = airportRepository;
    this.flightRepository = flightRepository;
  }

  public FlightGraph snapshot() {
    return FlightGraph.of(airportRepository.findAll(), flightRepository.findAll());
  }
}
