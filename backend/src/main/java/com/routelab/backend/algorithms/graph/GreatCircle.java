package com.routelab.backend.algorithms.graph;

import com.routelab.backend.domain.Airport;

/**
 * Haversine great-circle distance between airports.
 */
public final class GreatCircle {

  public static final double EARTH_RADIUS_KM = 6371.0;

  private GreatCircle() {
    // utility class
  }

  public static double distanceKm(Airport from, Airport to) {
    return distanceKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
  }

  public static double distanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
    double lat1Rad = Math.toRadians(lat1Deg);
    double lat2Rad = Math.toRadians(lat2Deg);
    double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
    double deltaLonRad = Math.toRadians(normalizeDeltaLongitude(lon2Deg - lon1Deg));

    double sinHalfLat = Math.sin(deltaLatRad * 0.5);
    double sinHalfLon = Math.sin(deltaLonRad * 0.5);

    double a = sinHalfLat * sinHalfLat
        + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
    // rounding can push a slightly outside [0, 1]
    double clamped = Math.max(0.0, Math.min(1.0, a));
    return 2.0 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(clamped));
  }

  /**
   * Bring a longitude delta into (-180, 180].
   */
  static double normalizeDeltaLongitude(double deltaLonDeg) {
    double normalized = ((deltaLonDeg + 540.0) % 360.0) - 180.0;
    return normalized == -180.0 ? 180.0 : normalized;
  }
}
