package com.routelab.backend.dto;

/**
 * Body returned for every rejected or failed request.
 */
public record ErrorResponse(boolean success, String error) {

  public static ErrorResponse of(String message) {
    return new ErrorResponse(false, message);
  }
}
