package com.verlumen.treeopt.constraints;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Inclusive bounds on the number of allocated socket nodes. */
@AutoValue
public abstract class SocketRequirement {
  public static SocketRequirement of(int min, int max) {
    checkArgument(min >= 0 && max >= min, "Invalid socket bounds [%s, %s]", min, max);
    return new AutoValue_SocketRequirement(min, max);
  }

  public static SocketRequirement none() {
    return of(0, Integer.MAX_VALUE);
  }

  public abstract int min();

  public abstract int max();

  public int deficit(int sockets) {
    return Math.max(0, min() - sockets);
  }

  public int excess(int sockets) {
    return Math.max(0, sockets - max());
  }
}
