package com.verlumen.treeopt.pareto;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.treeopt.fitness.ObjectiveVector;

/** Pareto dominance for maximized objectives. */
public final class Dominance {
  /**
   * True iff {@code a} is at least as good as {@code b} on every objective and strictly better on
   * at least one.
   */
  public static boolean dominates(ObjectiveVector a, ObjectiveVector b) {
    checkArgument(a.size() == b.size(), "Vectors differ in size: %s vs %s", a.size(), b.size());
    boolean strictlyBetter = false;
    for (int i = 0; i < a.size(); i++) {
      if (a.get(i) < b.get(i)) {
        return false;
      }
      if (a.get(i) > b.get(i)) {
        strictlyBetter = true;
      }
    }
    return strictlyBetter;
  }

  private Dominance() {}
}
