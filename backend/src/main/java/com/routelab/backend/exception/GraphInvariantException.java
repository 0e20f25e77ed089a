package com.routelab.backend.exception;

/**
 * Internal consistency violation detected while solving a query, such as a
 * negative edge weight or a cycle in the parent-pointer map.
 */
public class GraphInvariantException extends IllegalStateException {

  public GraphInvariantException(String message) {
    super(message);
  }

  public GraphInvariantException(String message, Throwable cause) {
    super(message, cause);
  }
}
