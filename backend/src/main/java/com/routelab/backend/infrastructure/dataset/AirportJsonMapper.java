package com.routelab.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.routelab.backend.domain.Airport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
public class AirportJsonMapper {

  private static final Logger log = LoggerFactory.getLogger(AirportJsonMapper.class);

  private static final Pattern AIRPORT_CODE = Pattern.compile("[A-Z]{2,4}");

  private enum AirportJsonField {
    CODE("code"),
    NAME("name"),
    CITY("city"),
    COUNTRY("country"),
    LATITUDE("latitude"),
    LONGITUDE("longitude");

    private final String jsonKey;

    AirportJsonField(String jsonKey) {
      this.jsonKey = jsonKey;
    }

    public String jsonKey() {
      return jsonKey;
    }
  }

  private record Coordinates(double latitude, double longitude) {}

  /**
   * Convert a single JSON node into an Airport, or empty if invalid.
   */
  public Optional<Airport> toAirport(JsonNode node) {
    Map<AirportJsonField, String> raw = new EnumMap<>(AirportJsonField.class);
    for (AirportJsonField field : AirportJsonField.values()) {
      raw.put(field, textOrNull(node, field.jsonKey()));
    }

    List<AirportJsonField> missingFields = raw.entrySet().stream()
        .filter(e -> e.getValue() == null || e.getValue().isBlank())
        .map(Map.Entry::getKey)
        .toList();

    if (!missingFields.isEmpty()) {
      log.warn(
          "Skipping airport due to missing fields {}. Raw values: {}",
          missingFields, raw
      );
      return Optional.empty();
    }

    String code = raw.get(AirportJsonField.CODE).trim();
    if (!AIRPORT_CODE.matcher(code).matches()) {
      log.warn("Skipping airport with malformed code '{}' (expected 2-4 uppercase letters)", code);
      return Optional.empty();
    }

    Optional<Coordinates> coordinatesOpt = parseCoordinates(
        code, raw.get(AirportJsonField.LATITUDE), raw.get(AirportJsonField.LONGITUDE));
    if (coordinatesOpt.isEmpty()) {
      return Optional.empty();
    }
    Coordinates coordinates = coordinatesOpt.get();

    Airport airport = new Airport(
        code,
        raw.get(AirportJsonField.NAME),
        raw.get(AirportJsonField.CITY),
        raw.get(AirportJsonField.COUNTRY),
        coordinates.latitude(),
        coordinates.longitude()
    );
    return Optional.of(airport);
  }

  private Optional<Coordinates> parseCoordinates(String code, String latitudeText, String longitudeText) {
    try {
      double latitude = Double.parseDouble(latitudeText);
      double longitude = Double.parseDouble(longitudeText);

      if (!Double.isFinite(latitude) || !Double.isFinite(longitude)
          || Math.abs(latitude) > 90.0 || Math.abs(longitude) > 180.0) {
        log.warn(
            "Skipping airport {} with out-of-range coordinates lat={}, lon={}",
            code, latitude, longitude
        );
        return Optional.empty();
      }
      return Optional.of(new Coordinates(latitude, longitude));
    } catch (NumberFormatException e) {
      log.warn(
          "Skipping airport {} with invalid coordinates lat='{}', lon='{}'",
          code, latitudeText, longitudeText
      );
      return Optional.empty();
    }
  }

  private String textOrNull(JsonNode node, String fieldName) {
    JsonNode value = node.get(fieldName);
    return value != null && !value.isNull() ? value.asText() : null;
  }
}
