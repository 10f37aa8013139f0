package com.verlumen.treeopt.genetic;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.fitness.Baseline;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.GenerationStats;
import com.verlumen.treeopt.model.Individual;
import com.verlumen.treeopt.model.RunStatus;
import java.util.Optional;

/** Outcome of a genetic run. */
@AutoValue
public abstract class GeneticOptimizationResult {
  public static Builder builder() {
    return new AutoValue_GeneticOptimizationResult.Builder()
        .setHistory(ImmutableList.of())
        .setFinalPopulation(ImmutableList.of())
        .setGenerations(0)
        .setEvaluations(0)
        .setFailedEvaluations(0);
  }

  public abstract Allocation seed();

  public abstract Allocation best();

  public abstract double bestFitness();

  public abstract double seedFitness();

  /** The individual behind {@link #best()}, with its lineage. Empty if no generation finished. */
  public abstract Optional<Individual> bestIndividual();

  public abstract RunStatus status();

  /** Generations evaluated. */
  public abstract int generations();

  public abstract ImmutableList<GenerationStats> history();

  /** Last generation, best first. */
  public abstract ImmutableList<Individual> finalPopulation();

  public abstract long evaluations();

  public abstract long failedEvaluations();

  public abstract Optional<Baseline> baseline();

  public abstract Optional<String> message();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSeed(Allocation seed);

    public abstract Builder setBest(Allocation best);

    public abstract Builder setBestFitness(double bestFitness);

    public abstract Builder setSeedFitness(double seedFitness);

    public abstract Builder setBestIndividual(Individual bestIndividual);

    public abstract Builder setStatus(RunStatus status);

    public abstract Builder setGenerations(int generations);

    public abstract Builder setHistory(ImmutableList<GenerationStats> history);

    public abstract Builder setFinalPopulation(ImmutableList<Individual> finalPopulation);

    public abstract Builder setEvaluations(long evaluations);

    public abstract Builder setFailedEvaluations(long failedEvaluations);

    public abstract Builder setBaseline(Baseline baseline);

    public abstract Builder setMessage(String message);

    public abstract GeneticOptimizationResult build();
  }
}
