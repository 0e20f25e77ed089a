package com.routelab.backend.algorithms.shortestpath;

public enum SearchStepKind {
  START,
  EXTRACT,
  STALE_ENTRY,
  RELAX,
  FINISH
}
