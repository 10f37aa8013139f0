package com.verlumen.treeopt.model;

import com.google.common.collect.ImmutableList;

/** Thrown before a run starts when the seed allocation itself breaks an invariant. */
public final class InvalidSeedException extends RuntimeException {
  private final ImmutableList<String> problems;

  public InvalidSeedException(String message) {
    this(message, ImmutableList.of());
  }

  public InvalidSeedException(String message, ImmutableList<String> problems) {
    super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
    this.problems = problems;
  }

  public ImmutableList<String> problems() {
    return problems;
  }
}
