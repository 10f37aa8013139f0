package com.verlumen.treeopt.greedy;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.fitness.Baseline;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.RunStatus;
import java.util.Optional;

/** Outcome of a local search run. */
@AutoValue
public abstract class GreedyResult {
  public static Builder builder() {
    return new AutoValue_GreedyResult.Builder()
        .setMoves(ImmutableList.of())
        .setFitnessHistory(ImmutableList.of())
        .setIterations(0)
        .setEvaluations(0)
        .setFailedEvaluations(0);
  }

  public abstract Allocation seed();

  public abstract Allocation best();

  /** Fitness of {@link #best()}; the seed scores zero less its constraint penalty. */
  public abstract double bestFitness();

  public abstract double seedFitness();

  public abstract RunStatus status();

  /** Improving moves applied, in order. */
  public abstract ImmutableList<Move> moves();

  /** Fitness after each applied move. */
  public abstract ImmutableList<Double> fitnessHistory();

  public abstract int iterations();

  public abstract long evaluations();

  public abstract long failedEvaluations();

  public abstract Optional<Baseline> baseline();

  /** Why the run aborted. */
  public abstract Optional<String> message();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSeed(Allocation seed);

    public abstract Builder setBest(Allocation best);

    public abstract Builder setBestFitness(double bestFitness);

    public abstract Builder setSeedFitness(double seedFitness);

    public abstract Builder setStatus(RunStatus status);

    public abstract Builder setMoves(ImmutableList<Move> moves);

    public abstract Builder setFitnessHistory(ImmutableList<Double> fitnessHistory);

    public abstract Builder setIterations(int iterations);

    public abstract Builder setEvaluations(long evaluations);

    public abstract Builder setFailedEvaluations(long failedEvaluations);

    public abstract Builder setBaseline(Baseline baseline);

    public abstract Builder setMessage(String message);

    public abstract GreedyResult build();
  }
}
