package com.verlumen.treeopt.evaluation;

/** Why a single evaluation produced no metrics. */
public enum FailureKind {
  /** No response arrived within the call's timeout. */
  TIMEOUT,
  /** The worker process exited or its channel broke. */
  WORKER_DIED,
  /** The worker answered and reported that it could not evaluate the allocation. */
  REJECTED,
  /** The worker answered with something that is not a valid response. */
  MALFORMED_RESPONSE,
  /** The worker was not started or not ready. */
  NOT_READY;

  /** Failures after which the worker can no longer be trusted with requests. */
  public boolean isWorkerFault() {
    return this == TIMEOUT || this == WORKER_DIED || this == NOT_READY;
  }
}
