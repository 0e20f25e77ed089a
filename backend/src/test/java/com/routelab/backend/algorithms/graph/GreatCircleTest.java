package com.routelab.backend.algorithms.graph;

import org.junit.jupiter.api.Test;

import static com.routelab.backend.ExampleNetwork.*;
import static org.junit.jupiter.api.Assertions.*;

class GreatCircleTest {

  @Test
  void distanceKm_shouldMatchKnownAirportPairs() {
    assertEquals(11349.68, GreatCircle.distanceKm(LHE, JFK), 0.01);
    assertEquals(4176.43, GreatCircle.distanceKm(LHE, IST), 0.01);
  }

  @Test
  void distanceKm_shouldBeSymmetricAndZeroForSamePoint() {
    assertEquals(GreatCircle.distanceKm(DOH, JFK), GreatCircle.distanceKm(JFK, DOH), 1e-9);
    assertEquals(0.0, GreatCircle.distanceKm(12.5, 45.0, 12.5, 45.0), 1e-9);
  }

  /**
   * Edge case:
   * Points on either side of the antimeridian are close, not half a world apart.
   */
  @Test
  void distanceKm_shouldTakeShortWayAcrossAntimeridian() {
    double across = GreatCircle.distanceKm(0.0, 179.5, 0.0, -179.5);

    assertEquals(111.19, across, 0.05);
  }

  @Test
  void distanceKm_antipodesShouldBeHalfCircumference() {
    double antipodal = GreatCircle.distanceKm(0.0, 0.0, 0.0, 180.0);

    assertEquals(Math.PI * GreatCircle.EARTH_RADIUS_KM, antipodal, 1e-6);
  }
}
