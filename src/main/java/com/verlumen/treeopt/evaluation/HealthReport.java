package com.verlumen.treeopt.evaluation;

import com.google.auto.value.AutoValue;

/** Result of one {@link WorkerPool#healthCheck()} pass. */
@AutoValue
public abstract class HealthReport {
  public static HealthReport create(
      int total, int alive, int dead, int restarted, int restartFailures) {
    return new AutoValue_HealthReport(total, alive, dead, restarted, restartFailures);
  }

  public abstract int total();

  /** Workers able to take requests after the check. */
  public abstract int alive();

  /** Workers found dead or unresponsive before the check. */
  public abstract int dead();

  public abstract int restarted();

  public abstract int restartFailures();

  public boolean healthy() {
    return alive() == total();
  }
}
