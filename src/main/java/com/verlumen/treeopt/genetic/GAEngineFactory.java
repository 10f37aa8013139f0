package com.verlumen.treeopt.genetic;

import com.google.common.util.concurrent.MoreExecutors;
import com.verlumen.treeopt.evolution.AllocationGene;
import com.verlumen.treeopt.evolution.AllocationMutator;
import com.verlumen.treeopt.evolution.PopulationEvaluator;
import com.verlumen.treeopt.evolution.PopulationInitializer;
import com.verlumen.treeopt.evolution.UnionCrossover;
import io.jenetics.EliteSelector;
import io.jenetics.Selector;
import io.jenetics.TournamentSelector;
import io.jenetics.engine.Engine;
import io.jenetics.engine.EvolutionInterceptor;

/** Builds the Jenetics engine for one genetic run. */
final class GAEngineFactory {
  private GAEngineFactory() {}

  /**
   * Offspring are tournament winners altered by union crossover and then mutation. The survivors
   * are exactly the {@code elitismCount} best phenotypes, copied unchanged.
   *
   * <p>The engine runs on the calling thread so that the caller's random scope applies to
   * selection and alteration; evaluation is concurrent inside {@code evaluator}.
   */
  static Engine<AllocationGene, Double> createEngine(
      GeneticConfig config,
      PopulationEvaluator evaluator,
      PopulationInitializer initializer,
      UnionCrossover crossover,
      AllocationMutator mutator,
      EvolutionInterceptor<AllocationGene, Double> interceptor) {
    return new Engine.Builder<>(evaluator, initializer)
        .populationSize(config.populationSize())
        .offspringSelector(new TournamentSelector<>(config.tournamentSize()))
        .survivorsSelector(survivorsSelector(config))
        .survivorsSize(config.elitismCount())
        .alterers(crossover, mutator)
        .maximizing()
        .maximalPhenotypeAge(config.maxGenerations() + 1L)
        .executor(MoreExecutors.directExecutor())
        .interceptor(interceptor)
        .build();
  }

  private static Selector<AllocationGene, Double> survivorsSelector(GeneticConfig config) {
    TournamentSelector<AllocationGene, Double> tournament =
        new TournamentSelector<>(config.tournamentSize());
    return config.elitismCount() > 0
        ? new EliteSelector<>(config.elitismCount(), tournament)
        : tournament;
  }
}
