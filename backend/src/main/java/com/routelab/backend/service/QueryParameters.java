package com.routelab.backend.service;

import com.routelab.backend.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization and range checks shared by the query services.
 */
public final class QueryParameters {

  private static final Pattern AIRPORT_CODE = Pattern.compile("[A-Z]{2,4}");

  private QueryParameters() {
    // utility class
  }

  /**
   * Trim and upper-case an airport code, rejecting anything that is not
   * 2-4 letters.
   */
  public static String airportCode(String parameterName, String rawValue) {
    if (rawValue == null || rawValue.isBlank()) {
      throw new ValidationException(parameterName + " must not be blank");
    }
    String code = rawValue.trim().toUpperCase(Locale.ROOT);
    if (!AIRPORT_CODE.matcher(code).matches()) {
      throw new ValidationException(parameterName + " must be a 2-4 letter airport code, got '" + rawValue + "'");
    }
    return code;
  }

  /**
   * {@code value} if present, otherwise {@code defaultValue}; either must lie in [min, max].
   */
  public static int intInRange(String parameterName, Integer value, int defaultValue, int min, int max) {
    int effective = value != null ? value : defaultValue;
    if (effective < min || effective > max) {
      throw new ValidationException(parameterName + " must be between " + min + " and " + max + ", got " + effective);
    }
    return effective;
  }
}
