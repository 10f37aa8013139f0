package com.verlumen.treeopt.genetic;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.treeopt.fitness.Objective;

@AutoValue
public abstract class GeneticConfig {
  public static GeneticConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_GeneticConfig.Builder()
        .setPopulationSize(GAConstants.DEFAULT_POPULATION_SIZE)
        .setMaxGenerations(GAConstants.DEFAULT_MAX_GENERATIONS)
        .setMutationRate(GAConstants.MUTATION_PROBABILITY)
        .setCrossoverRate(GAConstants.CROSSOVER_PROBABILITY)
        .setElitismCount(GAConstants.ELITISM_COUNT)
        .setTournamentSize(GAConstants.TOURNAMENT_SIZE)
        .setUnionInclusionProbability(GAConstants.UNION_INCLUSION_PROBABILITY)
        .setConvergenceWindow(GAConstants.CONVERGENCE_WINDOW)
        .setConvergenceEpsilon(GAConstants.CONVERGENCE_EPSILON)
        .setMinAllocationSize(GAConstants.MIN_ALLOCATION_SIZE)
        .setInitialVariationMaxChanges(GAConstants.INITIAL_VARIATION_MAX_CHANGES)
        .setObjective(Objective.DPS)
        .setOptimizeMasteries(true);
  }

  public abstract int populationSize();

  /** Generations evaluated at most, generation zero included. */
  public abstract int maxGenerations();

  public abstract double mutationRate();

  public abstract double crossoverRate();

  /** Best individuals copied unchanged into each next generation. */
  public abstract int elitismCount();

  public abstract int tournamentSize();

  /** Chance that a node unique to one parent is inherited. */
  public abstract double unionInclusionProbability();

  /** Generations without an improvement above {@link #convergenceEpsilon()} before stopping. */
  public abstract int convergenceWindow();

  public abstract double convergenceEpsilon();

  public abstract int minAllocationSize();

  public abstract int initialVariationMaxChanges();

  public abstract Objective objective();

  public abstract boolean optimizeMasteries();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setMaxGenerations(int maxGenerations);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setCrossoverRate(double crossoverRate);

    public abstract Builder setElitismCount(int elitismCount);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setUnionInclusionProbability(double probability);

    public abstract Builder setConvergenceWindow(int convergenceWindow);

    public abstract Builder setConvergenceEpsilon(double convergenceEpsilon);

    public abstract Builder setMinAllocationSize(int minAllocationSize);

    public abstract Builder setInitialVariationMaxChanges(int maxChanges);

    public abstract Builder setObjective(Objective objective);

    public abstract Builder setOptimizeMasteries(boolean optimizeMasteries);

    abstract GeneticConfig autoBuild();

    public GeneticConfig build() {
      GeneticConfig config = autoBuild();
      checkArgument(config.populationSize() >= 2, "Population size must be at least 2");
      checkArgument(config.maxGenerations() >= 1, "Max generations must be at least 1");
      checkArgument(
          config.elitismCount() >= 0 && config.elitismCount() < config.populationSize(),
          "Elitism count must be in [0, population size)");
      checkArgument(config.tournamentSize() >= 1, "Tournament size must be at least 1");
      checkArgument(config.convergenceWindow() >= 1, "Convergence window must be at least 1");
      return config;
    }
  }
}
