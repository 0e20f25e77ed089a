package com.routelab.backend.domain;

import java.util.Objects;

/**
 * Graph vertex: an airport identified by its code, with the coordinates
 * used for great-circle distances.
 */
public class Airport {

  private final String code;
  private final String name;
  private final String city;
  private final String country;
  private final double latitude;
  private final double longitude;

  public Airport(String code,
      String name,
      String city,
      String country,
      double latitude,
      double longitude) {
    this.code = Objects.requireNonNull(code, "code must not be null");
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.city = Objects.requireNonNull(city, "city must not be null");
    this.country = Objects.requireNonNull(country, "country must not be null");

    if (latitude < -90.0 || latitude > 90.0) {
      throw new IllegalArgumentException("latitude out of range for " + code + ": " + latitude);
    }
    if (longitude < -180.0 || longitude > 180.0) {
      throw new IllegalArgumentException("longitude out of range for " + code + ": " + longitude);
    }
    this.latitude = latitude;
    this.longitude = longitude;
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public String getCity() {
    return city;
  }

  public String getCountry() {
    return country;
  }

  public double getLatitude() {
    return latitude;
  }

  public double getLongitude() {
    return longitude;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return code.equals(((Airport) o).code);
  }

  @Override
  public int hashCode() {
    return code.hashCode();
  }

  @Override
  public String toString() {
    return code;
  }
}
