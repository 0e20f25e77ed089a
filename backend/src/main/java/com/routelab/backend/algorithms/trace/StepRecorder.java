package com.routelab.backend.algorithms.trace;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Capped, append-only list of algorithm snapshots.
 *
 * Snapshots are built lazily: once {@code maxStates} entries are held the
 * factory is no longer invoked, so a full recorder costs nothing while the
 * algorithm keeps running to completion.
 *
 * @param <S> snapshot type
 */
public class StepRecorder<S> {

  private final int maxStates;
  private final List<S> states = new ArrayList<>();
  private boolean truncated;

  public StepRecorder(int maxStates) {
    if (maxStates < 0) {
      throw new IllegalArgumentException("maxStates must not be negative: " + maxStates);
    }
    this.maxStates = maxStates;
  }

  /**
   * Append a snapshot built from its step index, unless the cap is reached.
   *
   * @return true if the snapshot was recorded
   */
  public boolean record(IntFunction<S> snapshotForStep) {
    if (states.size() >= maxStates) {
      truncated = true;
      return false;
    }
    states.add(snapshotForStep.apply(states.size()));
    return true;
  }

  public boolean isFull() {
    return states.size() >= maxStates;
  }

  /**
   * True when at least one snapshot was dropped because of the cap.
   */
  public boolean isTruncated() {
    return truncated;
  }

  public int getMaxStates() {
    return maxStates;
  }

  public int size() {
    return states.size();
  }

  public List<S> states() {
    return List.copyOf(states);
  }
}
