package com.routelab.backend.algorithms.mst;

import com.routelab.backend.exception.ValidationException;

import java.util.Locale;

/**
 * Which airports the spanning tree covers.
 */
public enum MstScope {

  /**
   * Airports and flights on the bounded-hop paths between source and destination.
   */
  ROUTE("route"),

  /**
   * The weakly connected component that contains the source airport.
   */
  COMPONENT("component");

  private final String parameterName;

  MstScope(String parameterName) {
    this.parameterName = parameterName;
  }

  public String parameterName() {
    return parameterName;
  }

  public static MstScope fromParameter(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("MST scope must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (MstScope scope : values()) {
      if (scope.parameterName.equals(normalized)) {
        return scope;
      }
    }
    throw new ValidationException("Unsupported MST scope: " + value);
  }
}
