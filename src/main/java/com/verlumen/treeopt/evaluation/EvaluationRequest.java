package com.verlumen.treeopt.evaluation;

import com.google.auto.value.AutoValue;
import com.verlumen.treeopt.model.Allocation;

/** One allocation sent to a worker, tagged so that its response can be matched. */
@AutoValue
public abstract class EvaluationRequest {
  public static EvaluationRequest create(long requestId, Allocation allocation) {
    return new AutoValue_EvaluationRequest(requestId, allocation);
  }

  public abstract long requestId();

  public abstract Allocation allocation();
}
