package com.routelab.backend.algorithms.mst;

import com.routelab.backend.exception.ValidationException;

import java.util.Locale;

public enum MstAlgorithm {

  PRIM("prim"),
  KRUSKAL("kruskal");

  private final String parameterName;

  MstAlgorithm(String parameterName) {
    this.parameterName = parameterName;
  }

  public String parameterName() {
    return parameterName;
  }

  public static MstAlgorithm fromParameter(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("MST algorithm must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (MstAlgorithm algorithm : values()) {
      if (algorithm.parameterName.equals(normalized)) {
        return algorithm;
      }
    }
    throw new ValidationException("Unsupported MST algorithm: " + value);
  }
}
