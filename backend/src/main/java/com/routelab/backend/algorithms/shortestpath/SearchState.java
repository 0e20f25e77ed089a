package com.routelab.backend.algorithms.shortestpath;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a Dijkstra search at one recorded step.
 * {@code relaxation} is set only for RELAX steps, {@code routePath} only
 * on a FINISH step that found a route.
 */
public record SearchState(int step,
                          SearchStepKind kind,
                          String currentNode,
                          List<String> visited,
                          List<FrontierEntry> frontier,
                          Map<String, Double> distances,
                          Map<String, String> cameFrom,
                          Relaxation relaxation,
                          List<String> routePath) {
}
