package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.domain.Route;

import java.util.Optional;

/**
 * Side channel for watching a Dijkstra search. Observers never influence
 * the search result.
 */
public interface SearchObserver {

  SearchObserver NO_OP = new SearchObserver() {
  };

  default void onStart(SearchFrame frame) {
  }

  default void onExtract(SearchFrame frame) {
  }

  /**
   * A heap entry whose node was already finalized was popped and ignored.
   */
  default void onStaleEntry(SearchFrame frame, FrontierEntry entry) {
  }

  default void onRelax(SearchFrame frame, Relaxation relaxation) {
  }

  default void onFinish(SearchFrame frame, Optional<Route> route) {
  }
}
