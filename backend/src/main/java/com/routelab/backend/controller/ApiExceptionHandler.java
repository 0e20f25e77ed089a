package com.routelab.backend.controller;

import com.routelab.backend.dto.ErrorResponse;
import com.routelab.backend.exception.GraphInvariantException;
import com.routelab.backend.exception.UnknownAirportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain exceptions onto HTTP status codes for every controller:
 *  - bad input (ValidationException and other IllegalArgumentExceptions) -> 400
 *  - unknown airport -> 404
 *  - broken graph invariants -> 500
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Bad request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
    log.warn("Bad request: missing parameter '{}'", ex.getParameterName());
    return respond(HttpStatus.BAD_REQUEST, ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    log.warn("Bad request: parameter '{}' has invalid value '{}'", ex.getName(), ex.getValue());
    return respond(HttpStatus.BAD_REQUEST, ex.getName() + " must be an integer");
  }

  @ExceptionHandler(UnknownAirportException.class)
  public ResponseEntity<ErrorResponse> handleUnknownAirport(UnknownAirportException ex) {
    log.warn("Unknown airport: {}", ex.getAirportCode());
    return respond(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(GraphInvariantException.class)
  public ResponseEntity<ErrorResponse> handleGraphInvariant(GraphInvariantException ex) {
    log.error("Graph invariant violated", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal graph error: " + ex.getMessage());
  }

  private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(ErrorResponse.of(message));
  }
}
