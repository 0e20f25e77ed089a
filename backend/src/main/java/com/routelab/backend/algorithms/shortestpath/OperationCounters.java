package com.routelab.backend.algorithms.shortestpath;

/**
 * Basic-operation tallies for one Dijkstra run.
 */
public final class OperationCounters {

  private long extractMinOps;
  private long relaxOps;
  private long comparisons;
  private long heapOps;

  void extractMin() {
    extractMinOps++;
  }

  void relax() {
    relaxOps++;
  }

  void compare() {
    comparisons++;
  }

  void compare(long count) {
    comparisons += count;
  }

  void heapOperation() {
    heapOps++;
  }

  public long getExtractMinOps() {
    return extractMinOps;
  }

  public long getRelaxOps() {
    return relaxOps;
  }

  public long getComparisons() {
    return comparisons;
  }

  /**
   * Pushes and pops on the binary heap; always 0 for the array strategy.
   */
  public long getHeapOps() {
    return heapOps;
  }
}
