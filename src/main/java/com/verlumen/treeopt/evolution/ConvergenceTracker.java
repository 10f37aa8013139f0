package com.verlumen.treeopt.evolution;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Detects a stalled search: converged once the best fitness has not risen by more than {@code
 * epsilon} for {@code window} consecutive updates.
 *
 * <p>Backs the evolution stream limit. Unlike {@link io.jenetics.engine.Limits#bySteadyFitness},
 * gains up to {@code epsilon} count as stalled and the best ever fitness is tracked rather than the
 * generation's best.
 */
public final class ConvergenceTracker {
  private final int window;
  private final double epsilon;
  private double reference = Double.NEGATIVE_INFINITY;
  private int stalled;

  private ConvergenceTracker(int window, double epsilon) {
    this.window = window;
    this.epsilon = epsilon;
  }

  public static ConvergenceTracker create(int window, double epsilon) {
    checkArgument(window >= 1, "Window must be at least 1: %s", window);
    checkArgument(epsilon >= 0.0, "Epsilon must not be negative: %s", epsilon);
    return new ConvergenceTracker(window, epsilon);
  }

  /** Records this generation's best fitness and reports whether the search has converged. */
  public boolean update(double bestFitness) {
    if (bestFitness > reference + epsilon) {
      reference = bestFitness;
      stalled = 0;
    } else {
      stalled++;
    }
    return hasConverged();
  }

  public boolean hasConverged() {
    return stalled >= window;
  }

  public int stalledGenerations() {
    return stalled;
  }
}
