package com.routelab.backend.service;

import com.routelab.backend.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class QueryParametersTest {

  @Test
  void airportCode_shouldTrimAndUpperCase() {
    assertEquals("LHE", QueryParameters.airportCode("source", " lhe "));
    assertEquals("JFK", QueryParameters.airportCode("dest", "JFK"));
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "L", "LONGER", "J4K", "L-E"})
  void airportCode_shouldRejectMalformedValues(String value) {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> QueryParameters.airportCode("source", value));
    assertTrue(ex.getMessage().startsWith("source"), "Message should name the parameter");
  }

  @Test
  void intInRange_shouldFallBackToDefault() {
    assertEquals(2, QueryParameters.intInRange("max_stops", null, 2, 0, 4));
    assertEquals(0, QueryParameters.intInRange("max_stops", 0, 2, 0, 4));
    assertEquals(4, QueryParameters.intInRange("max_stops", 4, 2, 0, 4));
  }

  @Test
  void intInRange_shouldRejectValuesOutsideBounds() {
    assertThrows(ValidationException.class, () -> QueryParameters.intInRange("max_stops", -1, 2, 0, 4));
    assertThrows(ValidationException.class, () -> QueryParameters.intInRange("max_stops", 5, 2, 0, 4));
    assertThrows(ValidationException.class, () -> QueryParameters.intInRange("max_states", null, 9, 1, 5),
        "A default outside the bounds is rejected too");
  }

  @Test
  void routeQueryMode_shouldParseParameterNames() {
    assertEquals(RouteQueryMode.BEST_OVERALL, RouteQueryMode.fromParameter("Best_Overall"));
    assertEquals(RouteQueryMode.ALL, RouteQueryMode.fromParameter("all"));
    assertTrue(RouteQueryMode.ALL.optimization().isEmpty());
    assertEquals(RouteQueryMode.PARETO, RouteQueryMode.fromParameter("PARETO"));
    assertTrue(RouteQueryMode.PARETO.optimization().isEmpty());
    assertThrows(ValidationException.class, () -> RouteQueryMode.fromParameter("quickest"));
    assertThrows(ValidationException.class, () -> RouteQueryMode.fromParameter(" "));
  }
}
