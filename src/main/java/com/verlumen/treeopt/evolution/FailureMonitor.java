package com.verlumen.treeopt.evolution;

import com.google.common.flogger.FluentLogger;

/** Counts failed evaluations over a run and warns when a batch mostly fails. */
public final class FailureMonitor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private long evaluations;
  private long failures;

  public void record(int generation, int batchSize, int batchFailures) {
    evaluations += batchSize;
    failures += batchFailures;
    if (batchSize > 0 && batchFailures * 2 > batchSize) {
      logger.atWarning().log(
          "Generation %d: %d of %d evaluations failed (%d failures so far)",
          generation, batchFailures, batchSize, failures);
    } else if (batchFailures > 0) {
      logger.atFine().log(
          "Generation %d: %d of %d evaluations failed", generation, batchFailures, batchSize);
    }
  }

  public long evaluations() {
    return evaluations;
  }

  public long failures() {
    return failures;
  }
}
