package com.routelab.backend.controller;

import com.routelab.backend.dto.AirportSummaryDto;
import com.routelab.backend.infrastructure.dataset.AirportRepositoryInMemory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/airports")
public class AirportController {

  private final AirportRepositoryInMemory airportRepository;

  public AirportController(AirportRepositoryInMemory airportRepository) {
    this.airportRepository = airportRepository;
  }

  /**
   * Airports sorted by code, for source/destination pickers.
   */
  @GetMapping
  public List<AirportSummaryDto> listAirports() {
    return airportRepository.findAll().stream()
        .map(a -> new AirportSummaryDto(
            a.getCode(),
            a.getCity(),
            a.getName(),
            a.getCountry(),
            a.getLatitude(),
            a.getLongitude()
        ))
        .toList();
  }
}
