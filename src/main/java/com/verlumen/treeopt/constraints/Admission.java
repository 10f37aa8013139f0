package com.verlumen.treeopt.constraints;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.model.Allocation;

/** A candidate accepted into the search, possibly repaired, with the penalty it carries. */
@AutoValue
public abstract class Admission {
  public static Admission create(
      Allocation allocation, double penalty, ImmutableList<Violation> violations) {
    return new AutoValue_Admission(allocation, penalty, violations);
  }

  public abstract Allocation allocation();

  public abstract double penalty();

  /** Remaining violations; non-empty only under the soft-penalize policy. */
  public abstract ImmutableList<Violation> violations();
}
