package com.verlumen.treeopt.pareto;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.fitness.Baseline;
import com.verlumen.treeopt.fitness.Objective;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.GenerationStats;
import com.verlumen.treeopt.model.RunStatus;
import java.util.Optional;

/** Outcome of a multi-objective run: the frontier instead of a single winner. */
@AutoValue
public abstract class MultiObjectiveResult {
  public static Builder builder() {
    return new AutoValue_MultiObjectiveResult.Builder()
        .setHistory(ImmutableList.of())
        .setGenerations(0)
        .setEvaluations(0)
        .setFailedEvaluations(0);
  }

  public abstract Allocation seed();

  public abstract ImmutableList<Objective> objectives();

  public abstract ParetoFrontier frontier();

  public abstract RunStatus status();

  public abstract int generations();

  /** Per generation statistics of the mean objective score. */
  public abstract ImmutableList<GenerationStats> history();

  public abstract long evaluations();

  public abstract long failedEvaluations();

  public abstract Optional<Baseline> baseline();

  public abstract Optional<String> message();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSeed(Allocation seed);

    public abstract Builder setObjectives(ImmutableList<Objective> objectives);

    public abstract Builder setFrontier(ParetoFrontier frontier);

    public abstract Builder setStatus(RunStatus status);

    public abstract Builder setGenerations(int generations);

    public abstract Builder setHistory(ImmutableList<GenerationStats> history);

    public abstract Builder setEvaluations(long evaluations);

    public abstract Builder setFailedEvaluations(long failedEvaluations);

    public abstract Builder setBaseline(Baseline baseline);

    public abstract Builder setMessage(String message);

    public abstract MultiObjectiveResult build();
  }
}
