package com.routelab.backend.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.routelab.backend.ExampleNetwork.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Route}: leg chaining and aggregated totals.
 */
class RouteTest {

  @Test
  void constructor_shouldComputePathAndTotalsFromLegs() {
    // given
    Route route = Route.ofLegs(PK201, EK301, QR501);

    // then
    assertEquals(List.of("LHE", "DXB", "DOH", "JFK"), route.getPath());
    assertEquals("LHE", route.getOriginCode());
    assertEquals("JFK", route.getDestinationCode());
    assertEquals(2, route.getNumberOfStops());
    assertEquals(0, new BigDecimal("600").compareTo(route.getTotalPrice()));
    assertEquals(675L, route.getTotalDurationMinutes());

    double legSum = PK201.getDistanceKm() + EK301.getDistanceKm() + QR501.getDistanceKm();
    assertEquals(legSum, route.getTotalDistanceKm(), 1e-9);
    assertEquals("LHE->DXB->DOH->JFK", route.toString());
  }

  @Test
  void singleLegRoute_shouldHaveNoStops() {
    Route route = Route.ofSingleLeg(PK999);

    assertEquals(List.of("LHE", "JFK"), route.getPath());
    assertEquals(0, route.getNumberOfStops());
    assertEquals(11349.68, route.getTotalDistanceKm(), 0.01);
  }

  @Test
  void constructor_shouldRejectEmptyLegList() {
    assertThrows(IllegalArgumentException.class, () -> new Route(List.of()));
  }

  /**
   * Edge case:
   * A leg that does not depart from where the previous one arrived
   * cannot be part of a route.
   */
  @Test
  void constructor_shouldRejectBrokenChain() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> Route.ofLegs(PK201, QR501)
    );
    assertTrue(ex.getMessage().contains("QR501"));
  }

  @Test
  void legs_shouldBeUnmodifiable() {
    Route route = Route.ofLegs(PK201, EK301);

    assertThrows(UnsupportedOperationException.class, () -> route.getLegs().add(QR501));
    assertThrows(UnsupportedOperationException.class, () -> route.getPath().add("JFK"));
  }
}
