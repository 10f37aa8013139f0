package com.verlumen.treeopt.evaluation;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Outcome of one evaluation: metrics on success, a failure kind and message otherwise. */
@AutoValue
public abstract class EvaluationResult {
  public static EvaluationResult success(EvaluationMetrics metrics) {
    return new AutoValue_EvaluationResult(true, Optional.of(metrics), Optional.empty(), "");
  }

  public static EvaluationResult failure(FailureKind kind, String error) {
    return new AutoValue_EvaluationResult(false, Optional.empty(), Optional.of(kind), error);
  }

  public abstract boolean success();

  public abstract Optional<EvaluationMetrics> metrics();

  public abstract Optional<FailureKind> failureKind();

  public abstract String error();

  public EvaluationMetrics metricsOrThrow() {
    checkState(success(), "Evaluation failed: %s", error());
    return metrics().get();
  }

  public boolean failedWith(FailureKind kind) {
    return failureKind().map(kind::equals).orElse(false);
  }
}
