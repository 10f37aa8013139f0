package com.verlumen.treeopt.constraints;

import com.google.auto.value.AutoValue;

/** One broken constraint and how far the allocation is from satisfying it. */
@AutoValue
public abstract class Violation {
  public static Violation create(ViolationKind kind, int amount, String message) {
    return new AutoValue_Violation(kind, amount, message);
  }

  public abstract ViolationKind kind();

  /** Points, attribute points or sockets outside the bound. */
  public abstract int amount();

  public abstract String message();

  /** Structural violations cannot be traded against fitness. */
  public boolean isStructural() {
    return kind() == ViolationKind.UNKNOWN_NODE || kind() == ViolationKind.DISCONNECTED;
  }
}
