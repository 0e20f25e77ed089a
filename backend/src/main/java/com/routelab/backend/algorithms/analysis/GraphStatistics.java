package com.routelab.backend.algorithms.analysis;

import java.util.Map;

/**
 * Size, density and out-degree figures of the whole flight graph.
 * {@code density} is E / (V * (V - 1)) rounded to 4 decimals.
 */
public record GraphStatistics(int vertices,
                              int edges,
                              double density,
                              double averageDegree,
                              int maxDegree,
                              int minDegree,
                              Map<String, Integer> outDegrees,
                              Map<String, Integer> inDegrees) {
}
