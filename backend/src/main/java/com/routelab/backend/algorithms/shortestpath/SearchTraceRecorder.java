package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.algorithms.trace.StepRecorder;
import com.routelab.backend.domain.Route;

import java.util.List;
import java.util.Optional;

/**
 * Observer that turns search callbacks into capped {@link SearchState} snapshots.
 */
public class SearchTraceRecorder implements SearchObserver {

  private final StepRecorder<SearchState> recorder;

  public SearchTraceRecorder(int maxStates) {
    this.recorder = new StepRecorder<>(maxStates);
  }

  @Override
  public void onStart(SearchFrame frame) {
    capture(frame, SearchStepKind.START, null, null);
  }

  @Override
  public void onExtract(SearchFrame frame) {
    capture(frame, SearchStepKind.EXTRACT, null, null);
  }

  @Override
  public void onStaleEntry(SearchFrame frame, FrontierEntry entry) {
    capture(frame, SearchStepKind.STALE_ENTRY, null, null);
  }

  @Override
  public void onRelax(SearchFrame frame, Relaxation relaxation) {
    capture(frame, SearchStepKind.RELAX, relaxation, null);
  }

  @Override
  public void onFinish(SearchFrame frame, Optional<Route> route) {
    capture(frame, SearchStepKind.FINISH, null, route.map(Route::getPath).orElse(null));
  }

  private void capture(SearchFrame frame, SearchStepKind kind, Relaxation relaxation, List<String> routePath) {
    recorder.record(step -> new SearchState(
        step,
        kind,
        frame.currentNode().orElse(null),
        frame.visited(),
        frame.frontier(),
        frame.distances(),
        frame.cameFrom(),
        relaxation,
        routePath
    ));
  }

  public List<SearchState> states() {
    return recorder.states();
  }

  public boolean isTruncated() {
    return recorder.isTruncated();
  }
}
