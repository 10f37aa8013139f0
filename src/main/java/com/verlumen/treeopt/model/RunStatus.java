package com.verlumen.treeopt.model;

/** How an optimization run ended. */
public enum RunStatus {
  /** The iteration or generation cap was reached. */
  COMPLETED,
  /** No improving change was found, or the best fitness stalled for the configured window. */
  CONVERGED,
  /** The evaluator became unavailable; the result carries the best found so far. */
  ABORTED
}
