package com.routelab.backend.algorithms.shortestpath;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a running Dijkstra search, handed to observers.
 * Every call builds a fresh copy, so observers that ignore it pay nothing.
 */
public interface SearchFrame {

  Optional<String> currentNode();

  /**
   * Finalized airports in the order they were extracted.
   */
  List<String> visited();

  /**
   * Frontier contents ordered by cost, then airport code.
   */
  List<FrontierEntry> frontier();

  /**
   * Best-known cost for every reached airport, keyed by code.
   */
  Map<String, Double> distances();

  /**
   * Parent pointer for every reached airport except the source.
   */
  Map<String, String> cameFrom();
}
