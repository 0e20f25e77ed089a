package com.routelab.backend.exception;

/**
 * Malformed or out-of-range query input. Mapped to HTTP 400.
 */
public class ValidationException extends IllegalArgumentException {

  public ValidationException(String message) {
    super(message);
  }
}
