package com.routelab.backend.algorithms.analysis;

import java.math.BigDecimal;

public record AdjacencyEntry(String to, String flightNumber, String airline, BigDecimal price, int durationMinutes) {
}
