package com.routelab.backend.algorithms.mst;

public enum MstStepKind {
  START,
  ACCEPT,
  REJECT,
  FINISH
}
