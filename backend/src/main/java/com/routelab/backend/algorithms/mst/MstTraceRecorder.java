package com.routelab.backend.algorithms.mst;

import com.routelab.backend.algorithms.trace.StepRecorder;

import java.util.List;

public class MstTraceRecorder implements MstObserver {

  private final StepRecorder<MstState> recorder;

  public MstTraceRecorder(int maxStates) {
    this.recorder = new StepRecorder<>(maxStates);
  }

  @Override
  public void onStart(MstFrame frame) {
    capture(frame, MstStepKind.START, null);
  }

  @Override
  public void onEdgeConsidered(MstFrame frame, MstEdge edge, boolean accepted) {
    capture(frame, accepted ? MstStepKind.ACCEPT : MstStepKind.REJECT, edge);
  }

  @Override
  public void onFinish(MstFrame frame) {
    capture(frame, MstStepKind.FINISH, null);
  }

  private void capture(MstFrame frame, MstStepKind kind, MstEdge edge) {
    recorder.record(step -> new MstState(
        step,
        kind,
        frame.visited(),
        frame.acceptedEdges(),
        edge,
        frame.totalWeight()
    ));
  }

  public List<MstState> states() {
    return recorder.states();
  }

  public boolean isTruncated() {
    return recorder.isTruncated();
  }
}
