package com.verlumen.treeopt.constraints;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Inclusive bounds on the number of allocated nodes, root included. */
@AutoValue
public abstract class PointBudget {
  /** Points a character earns beyond its level from quests. */
  static final int QUEST_POINTS = 21;

  public static PointBudget of(int min, int max) {
    checkArgument(min >= 0, "Minimum must not be negative: %s", min);
    checkArgument(max >= min, "Maximum %s is below minimum %s", max, min);
    return new AutoValue_PointBudget(min, max);
  }

  public static PointBudget atMost(int max) {
    return of(0, max);
  }

  public static PointBudget unbounded() {
    return of(0, Integer.MAX_VALUE);
  }

  /**
   * Budget for a character of the given level. A negative {@code minOffset} sets the minimum that
   * many points below the maximum; otherwise there is no minimum.
   */
  public static PointBudget fromLevel(int level, int minOffset) {
    checkArgument(level >= 1, "Level must be positive: %s", level);
    int max = level + QUEST_POINTS;
    int min = minOffset < 0 ? Math.max(0, max + minOffset) : 0;
    return of(min, max);
  }

  public abstract int min();

  public abstract int max();

  public boolean contains(int points) {
    return points >= min() && points <= max();
  }

  /** Points missing to reach the minimum, or zero. */
  public int deficit(int points) {
    return Math.max(0, min() - points);
  }

  /** Points above the maximum, or zero. */
  public int excess(int points) {
    return Math.max(0, points - max());
  }
}
