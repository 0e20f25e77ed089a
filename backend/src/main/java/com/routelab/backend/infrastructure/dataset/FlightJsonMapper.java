package com.routelab.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.routelab.backend.domain.Airport;
import com.routelab.backend.domain.Flight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class FlightJsonMapper {

  private static final Logger log = LoggerFactory.getLogger(FlightJsonMapper.class);

  private enum FlightJsonField {
    FLIGHT_NUMBER("flightNumber", true),
    AIRLINE("airline", true),
    ORIGIN("origin", true),
    DESTINATION("destination", true),
    DURATION_MINUTES("durationMinutes", true),
    PRICE("price", true),
    DEPARTURE_TIME("departureTime", false),
    ARRIVAL_TIME("arrivalTime", false);

    private final String jsonKey;
    private final boolean required;

    FlightJsonField(String jsonKey, boolean required) {
      this.jsonKey = jsonKey;
      this.required = required;
    }

    public String jsonKey() {
      return jsonKey;
    }
  }

  private record AirportPair(Airport origin, Airport destination) {}
  private record Schedule(LocalTime departure, LocalTime arrival) {}

  /**
   * Convert a single JSON node into a Flight, or empty if invalid.
   *
   * @param node            flight JSON object
   * @param airportsByCode  map of airport code -> Airport
   */
  public Optional<Flight> toFlight(JsonNode node, Map<String, Airport> airportsByCode) {
    Map<FlightJsonField, String> raw = new EnumMap<>(FlightJsonField.class);
    for (FlightJsonField field : FlightJsonField.values()) {
      raw.put(field, textOrNull(node, field.jsonKey()));
    }

    List<FlightJsonField> missingFields = raw.entrySet().stream()
        .filter(e -> e.getKey().required)
        .filter(e -> e.getValue() == null || e.getValue().isBlank())
        .map(Map.Entry::getKey)
        .toList();

    if (!missingFields.isEmpty()) {
      log.warn(
          "Skipping flight due to missing fields {}. Raw values: {}",
          missingFields, raw
      );
      return Optional.empty();
    }

    String flightNumber = raw.get(FlightJsonField.FLIGHT_NUMBER);

    Optional<AirportPair> airportPairOpt = resolveAirports(
        flightNumber, raw.get(FlightJsonField.ORIGIN), raw.get(FlightJsonField.DESTINATION), airportsByCode);
    if (airportPairOpt.isEmpty()) {
      return Optional.empty();
    }
    AirportPair airports = airportPairOpt.get();

    Optional<Integer> durationOpt = parseDuration(flightNumber, raw.get(FlightJsonField.DURATION_MINUTES));
    if (durationOpt.isEmpty()) {
      return Optional.empty();
    }

    Optional<BigDecimal> priceOpt = parsePrice(flightNumber, raw.get(FlightJsonField.PRICE));
    if (priceOpt.isEmpty()) {
      return Optional.empty();
    }

    Optional<Schedule> scheduleOpt = parseSchedule(
        flightNumber, raw.get(FlightJsonField.DEPARTURE_TIME), raw.get(FlightJsonField.ARRIVAL_TIME));
    if (scheduleOpt.isEmpty()) {
      return Optional.empty();
    }
    Schedule schedule = scheduleOpt.get();

    Flight flight = new Flight(
        flightNumber,
        raw.get(FlightJsonField.AIRLINE),
        airports.origin(),
        airports.destination(),
        durationOpt.get(),
        priceOpt.get(),
        schedule.departure(),
        schedule.arrival()
    );

    return Optional.of(flight);
  }

  private Optional<AirportPair> resolveAirports(String flightNumber,
      String originCode,
      String destinationCode,
      Map<String, Airport> airportsByCode) {
    Airport origin = airportsByCode.get(originCode);
    if (origin == null) {
      log.warn(
          "Skipping flight {} due to unknown origin airport code: {}",
          flightNumber, originCode
      );
      return Optional.empty();
    }

    Airport destination = airportsByCode.get(destinationCode);
    if (destination == null) {
      log.warn(
          "Skipping flight {} due to unknown destination airport code: {}",
          flightNumber, destinationCode
      );
      return Optional.empty();
    }

    if (origin.getCode().equals(destination.getCode())) {
      log.warn("Skipping flight {} because it departs from and arrives at {}", flightNumber, originCode);
      return Optional.empty();
    }

    return Optional.of(new AirportPair(origin, destination));
  }

  private Optional<Integer> parseDuration(String flightNumber, String durationText) {
    try {
      int minutes = Integer.parseInt(durationText.trim());
      if (minutes < 0) {
        log.warn("Skipping flight {} due to negative duration {}", flightNumber, minutes);
        return Optional.empty();
      }
      return Optional.of(minutes);
    } catch (NumberFormatException e) {
      log.warn(
          "Skipping flight {} due to invalid duration '{}'",
          flightNumber, durationText
      );
      return Optional.empty();
    }
  }

  private Optional<BigDecimal> parsePrice(String flightNumber, String priceText) {
    try {
      BigDecimal price = new BigDecimal(priceText.trim());
      if (price.signum() < 0) {
        log.warn("Skipping flight {} due to negative price {}", flightNumber, price);
        return Optional.empty();
      }
      return Optional.of(price);
    } catch (NumberFormatException e) {
      log.warn(
          "Skipping flight {} due to invalid price '{}'",
          flightNumber, priceText
      );
      return Optional.empty();
    }
  }

  /**
   * Departure and arrival are optional, but present ones must be HH:mm.
   */
  private Optional<Schedule> parseSchedule(String flightNumber, String departureText, String arrivalText) {
    try {
      LocalTime departure = departureText == null || departureText.isBlank() ? null : LocalTime.parse(departureText);
      LocalTime arrival = arrivalText == null || arrivalText.isBlank() ? null : LocalTime.parse(arrivalText);
      return Optional.of(new Schedule(departure, arrival));
    } catch (DateTimeParseException e) {
      log.warn(
          "Skipping flight {} due to invalid schedule. departure='{}', arrival='{}'",
          flightNumber, departureText, arrivalText
      );
      return Optional.empty();
    }
  }

  private String textOrNull(JsonNode node, String fieldName) {
    JsonNode value = node.get(fieldName);
    return value != null && !value.isNull() ? value.asText() : null;
  }
}
