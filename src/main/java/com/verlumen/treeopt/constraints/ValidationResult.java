package com.verlumen.treeopt.constraints;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class ValidationResult {
  public static ValidationResult of(ImmutableList<Violation> violations) {
    return new AutoValue_ValidationResult(violations);
  }

  public abstract ImmutableList<Violation> violations();

  public boolean ok() {
    return violations().isEmpty();
  }

  public boolean hasStructuralViolation() {
    return violations().stream().anyMatch(Violation::isStructural);
  }

  public ImmutableList<String> messages() {
    return violations().stream().map(Violation::message).collect(ImmutableList.toImmutableList());
  }
}
