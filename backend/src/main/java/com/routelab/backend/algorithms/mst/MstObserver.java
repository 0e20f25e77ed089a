package com.routelab.backend.algorithms.mst;

public interface MstObserver {

  MstObserver NO_OP = new MstObserver() {
  };

  default void onStart(MstFrame frame) {
  }

  /**
   * An edge was taken from the candidate order and either joined the tree
   * or was rejected because it would close a cycle.
   */
  default void onEdgeConsidered(MstFrame frame, MstEdge edge, boolean accepted) {
  }

  default void onFinish(MstFrame frame) {
  }
}
