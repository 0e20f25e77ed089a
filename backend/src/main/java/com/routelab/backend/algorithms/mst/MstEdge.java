package com.routelab.backend.algorithms.mst;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Objects;

/**
 * Undirected, price-weighted edge. Endpoints are stored in ascending code
 * order; {@code flightNumber} names the cheapest flight between them.
 */
public record MstEdge(String from, String to, BigDecimal weight, String flightNumber, String airline) {

  /**
   * Shared by Prim and Kruskal: weight, then lower code, then higher code.
   */
  public static final Comparator<MstEdge> ORDER =
      Comparator.comparing(MstEdge::weight)
          .thenComparing(MstEdge::from)
          .thenComparing(MstEdge::to);

  public MstEdge {
    Objects.requireNonNull(from, "from must not be null");
    Objects.requireNonNull(to, "to must not be null");
    Objects.requireNonNull(weight, "weight must not be null");
    Objects.requireNonNull(flightNumber, "flightNumber must not be null");
    if (from.compareTo(to) >= 0) {
      throw new IllegalArgumentException("MST edge endpoints must be in ascending order: " + from + ", " + to);
    }
  }

  public boolean touches(String code) {
    return from.equals(code) || to.equals(code);
  }

  public String opposite(String code) {
    return from.equals(code) ? to : from;
  }
}
