package com.verlumen.treeopt.genetic;

import static com.verlumen.treeopt.evolution.AllocationChromosome.genotype;

import com.google.common.base.Throwables;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import com.verlumen.treeopt.evaluation.Evaluator;
import com.verlumen.treeopt.evaluation.EvaluatorUnavailableException;
import com.verlumen.treeopt.evolution.AllocationGene;
import com.verlumen.treeopt.evolution.AllocationMutator;
import com.verlumen.treeopt.evolution.ConvergenceTracker;
import com.verlumen.treeopt.evolution.FailureMonitor;
import com.verlumen.treeopt.evolution.PopulationEvaluator;
import com.verlumen.treeopt.evolution.PopulationInitializer;
import com.verlumen.treeopt.evolution.SeedValidator;
import com.verlumen.treeopt.evolution.UnionCrossover;
import com.verlumen.treeopt.fitness.Baseline;
import com.verlumen.treeopt.fitness.FitnessFunction;
import com.verlumen.treeopt.graph.ConnectivityRepairer;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.GenerationStats;
import com.verlumen.treeopt.model.Individual;
import com.verlumen.treeopt.model.Population;
import com.verlumen.treeopt.model.RunStatus;
import io.jenetics.Phenotype;
import io.jenetics.engine.Engine;
import io.jenetics.engine.EvolutionInterceptor;
import io.jenetics.engine.EvolutionResult;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import java.util.concurrent.CompletionException;
import java.util.random.RandomGenerator;

/**
 * Generational genetic algorithm on a Jenetics engine. Each generation is evaluated as one batch;
 * the best {@code elitismCount} individuals move on unchanged and the rest of the next generation
 * is bred from tournament winners. The run stops at the generation cap or when the best fitness
 * stalls.
 */
final class GeneticOptimizerImpl implements GeneticOptimizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Evaluator evaluator;
  private final ConstraintSet constraints;
  private final RandomGenerator random;

  @Inject
  GeneticOptimizerImpl(Evaluator evaluator, ConstraintSet constraints, RandomGenerator random) {
    this.evaluator = evaluator;
    this.constraints = constraints;
    this.random = random;
  }

  @Override
  public GeneticOptimizationResult optimize(Allocation seed, GeneticConfig config) {
    SeedValidator seedValidator = SeedValidator.create(constraints);
    seedValidator.validate(seed);
    logger.atInfo().log(
        "Starting genetic search for %s: population %d, up to %d generations",
        config.objective(), config.populationSize(), config.maxGenerations());

    GeneticOptimizationResult.Builder result = GeneticOptimizationResult.builder().setSeed(seed);
    Baseline baseline;
    try {
      baseline = seedValidator.baseline(seed, evaluator);
    } catch (EvaluatorUnavailableException e) {
      logger.atSevere().withCause(e).log("Evaluator unavailable before generation 0");
      return result
          .setBest(seed)
          .setBestFitness(FitnessFunction.FAILED_FITNESS)
          .setSeedFitness(FitnessFunction.FAILED_FITNESS)
          .setStatus(RunStatus.ABORTED)
          .setMessage(e.getMessage())
          .build();
    }
    FitnessFunction fitness = FitnessFunction.create(config.objective(), baseline);
    double seedFitness =
        fitness.penalized(EvaluationResult.success(baseline.metrics()), constraints.penalty(seed));

    PopulationEvaluator populationEvaluator =
        PopulationEvaluator.create(
            evaluator,
            constraints,
            new FailureMonitor(),
            (individual, evaluation, penalty) ->
                individual.assignFitness(
                    fitness.penalized(evaluation, penalty), penalty, evaluation));
    Population population = new Population();
    ConvergenceTracker convergence =
        ConvergenceTracker.create(config.convergenceWindow(), config.convergenceEpsilon());

    RunStatus status;
    try {
      status =
          RandomRegistry.with(
              random, r -> evolve(seed, config, populationEvaluator, population, convergence));
    } catch (EvaluatorUnavailableException e) {
      logger.atSevere().withCause(e).log(
          "Evaluator unavailable after generation %d; keeping best so far",
          population.generation());
      status = RunStatus.ABORTED;
      result.setMessage(e.getMessage());
    }

    int generations = population.history().size();
    FailureMonitor failures = populationEvaluator.failureMonitor();
    result
        .setBaseline(baseline)
        .setSeedFitness(seedFitness)
        .setStatus(status)
        .setGenerations(generations)
        .setHistory(population.history())
        .setEvaluations(failures.evaluations() + 1)
        .setFailedEvaluations(failures.failures());
    if (population.bestEver().isPresent()) {
      Individual best = population.bestEver().get();
      result
          .setBest(best.allocation())
          .setBestFitness(best.fitness())
          .setBestIndividual(best)
          .setFinalPopulation(population.ranked());
    } else {
      result.setBest(seed).setBestFitness(seedFitness);
    }
    GeneticOptimizationResult finished = result.build();
    logger.atInfo().log(
        "Genetic search %s after %d generations: fitness %.2f -> %.2f",
        status, generations, seedFitness, finished.bestFitness());
    return finished;
  }

  /**
   * Evaluates generation zero, then streams engine generations until the cap or convergence. Every
   * fully evaluated generation is recorded in {@code population}, so an abort keeps the last one.
   */
  private RunStatus evolve(
      Allocation seed,
      GeneticConfig config,
      PopulationEvaluator populationEvaluator,
      Population population,
      ConvergenceTracker convergence) {
    AllocationMutator mutator =
        AllocationMutator.create(
            constraints,
            config.minAllocationSize(),
            config.optimizeMasteries(),
            config.mutationRate());
    UnionCrossover crossover =
        UnionCrossover.create(
            constraints,
            ConnectivityRepairer.create(constraints.graph()),
            config.unionInclusionProbability(),
            config.crossoverRate());
    PopulationInitializer initializer =
        PopulationInitializer.create(
            constraints, mutator, seed, config.initialVariationMaxChanges());

    ISeq<Phenotype<AllocationGene, Double>> initial =
        populationEvaluator.eval(
            initializer.initialize(config.populationSize()).stream()
                .map(gene -> Phenotype.<AllocationGene, Double>of(genotype(gene), 0))
                .collect(ISeq.toISeq()));
    population.initialize(populationEvaluator.individuals(initial));
    if (record(population, convergence)) {
      return RunStatus.CONVERGED;
    }

    EvolutionInterceptor<AllocationGene, Double> recorder =
        EvolutionInterceptor.ofAfter(
            (EvolutionResult<AllocationGene, Double> evolved) -> {
              population.advance(populationEvaluator.individuals(evolved.population()));
              record(population, convergence);
              populationEvaluator.retain(evolved.population());
              return evolved;
            });
    Engine<AllocationGene, Double> engine =
        GAEngineFactory.createEngine(
            config, populationEvaluator, initializer, crossover, mutator, recorder);
    try {
      engine.stream(initial, 1)
          .limit(evolved -> !convergence.hasConverged())
          .limit(config.maxGenerations() - 1L)
          .forEach(
              evolved ->
                  logger.atFine().log(
                      "Engine generation %d: %d phenotypes",
                      evolved.generation(), evolved.population().size()));
    } catch (CompletionException e) {
      // Engine stages run as futures; surface a lost evaluator unwrapped.
      Throwables.throwIfInstanceOf(e.getCause(), EvaluatorUnavailableException.class);
      throw e;
    }
    return convergence.hasConverged() ? RunStatus.CONVERGED : RunStatus.COMPLETED;
  }

  /** Records the current generation and reports whether the search has converged. */
  private static boolean record(Population population, ConvergenceTracker convergence) {
    GenerationStats stats = population.record();
    double best = population.bestEver().orElseThrow().fitness();
    logger.atInfo().log(
        "Generation %d: best %.2f, mean %.2f, best ever %.2f",
        population.generation(), stats.best(), stats.mean(), best);
    boolean converged = convergence.update(best);
    if (converged) {
      logger.atInfo().log(
          "Converged after %d generations without improvement",
          convergence.stalledGenerations());
    }
    return converged;
  }
}
