package com.routelab.backend.algorithms.shortestpath;

/**
 * A (node, tentative cost) pair waiting in the search frontier.
 */
public record FrontierEntry(String node, double cost) {
}
