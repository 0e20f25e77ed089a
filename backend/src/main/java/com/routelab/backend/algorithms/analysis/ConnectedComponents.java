package com.routelab.backend.algorithms.analysis;

import java.util.List;

/**
 * Weakly connected components, largest first; airports sorted within each.
 */
public record ConnectedComponents(List<List<String>> components) {

  public ConnectedComponents {
    components = components.stream().map(List::copyOf).toList();
  }

  public int count() {
    return components.size();
  }

  public int largestSize() {
    return components.isEmpty() ? 0 : components.get(0).size();
  }

  public boolean isConnected() {
    return components.size() <= 1;
  }
}
