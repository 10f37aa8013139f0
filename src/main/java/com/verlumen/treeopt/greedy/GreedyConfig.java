package com.verlumen.treeopt.greedy;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.treeopt.fitness.Objective;

@AutoValue
public abstract class GreedyConfig {
  static final int DEFAULT_MAX_ITERATIONS = 100;
  static final int DEFAULT_CANDIDATES_PER_KIND = 20;

  public static GreedyConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_GreedyConfig.Builder()
        .setMaxIterations(DEFAULT_MAX_ITERATIONS)
        .setCandidatesPerKind(DEFAULT_CANDIDATES_PER_KIND)
        .setMinImprovement(0.0)
        .setOptimizeMasteries(true)
        .setEnableNodeAddition(true)
        .setObjective(Objective.DPS);
  }

  public abstract int maxIterations();

  /** Upper bound on removal candidates, and separately on addition candidates, per iteration. */
  public abstract int candidatesPerKind();

  /** A change is accepted only when it beats the current fitness by more than this. */
  public abstract double minImprovement();

  public abstract boolean optimizeMasteries();

  public abstract boolean enableNodeAddition();

  public abstract Objective objective();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxIterations(int maxIterations);

    public abstract Builder setCandidatesPerKind(int candidatesPerKind);

    public abstract Builder setMinImprovement(double minImprovement);

    public abstract Builder setOptimizeMasteries(boolean optimizeMasteries);

    public abstract Builder setEnableNodeAddition(boolean enableNodeAddition);

    public abstract Builder setObjective(Objective objective);

    abstract GreedyConfig autoBuild();

    public GreedyConfig build() {
      GreedyConfig config = autoBuild();
      checkArgument(config.maxIterations() >= 0, "Max iterations must not be negative");
      checkArgument(config.candidatesPerKind() >= 1, "Need at least one candidate per kind");
      checkArgument(config.minImprovement() >= 0.0, "Min improvement must not be negative");
      return config;
    }
  }
}
