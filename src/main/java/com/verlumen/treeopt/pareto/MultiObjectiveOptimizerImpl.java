package com.verlumen.treeopt.pareto;

import static com.verlumen.treeopt.evolution.AllocationChromosome.geneOf;
import static com.verlumen.treeopt.evolution.AllocationChromosome.genotype;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.math.Stats;
import com.google.inject.Inject;
import com.verlumen.treeopt.constraints.ConstraintSet;
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
import com.verlumen.treeopt.fitness.ObjectiveVector;
import com.verlumen.treeopt.fitness.ObjectiveVectorFunction;
import com.verlumen.treeopt.genetic.GeneticConfig;
import com.verlumen.treeopt.graph.ConnectivityRepairer;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.GenerationStats;
import com.verlumen.treeopt.model.Individual;
import com.verlumen.treeopt.model.Population;
import com.verlumen.treeopt.model.RunStatus;
import io.jenetics.Alterer;
import io.jenetics.Optimize;
import io.jenetics.Phenotype;
import io.jenetics.TournamentSelector;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * NSGA-II over the shared population mechanics. Offspring are bred from crowded-tournament winners;
 * parents and offspring are then ranked together and the next generation is filled front by front,
 * the last front that fits only partially being cut by crowding distance.
 */
final class MultiObjectiveOptimizerImpl implements MultiObjectiveOptimizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Evaluator evaluator;
  private final ConstraintSet constraints;
  private final RandomGenerator random;

  @Inject
  MultiObjectiveOptimizerImpl(
      Evaluator evaluator, ConstraintSet constraints, RandomGenerator random) {
    this.evaluator = evaluator;
    this.constraints = constraints;
    this.random = random;
  }

  @Override
  public MultiObjectiveResult optimize(Allocation seed, MultiObjectiveConfig config) {
    GeneticConfig genetic = config.genetic();
    SeedValidator seedValidator = SeedValidator.create(constraints);
    seedValidator.validate(seed);
    logger.atInfo().log(
        "Starting multi-objective search over %s: population %d, up to %d generations",
        config.objectives(), genetic.populationSize(), genetic.maxGenerations());

    MultiObjectiveResult.Builder result =
        MultiObjectiveResult.builder().setSeed(seed).setObjectives(config.objectives());
    Baseline baseline;
    try {
      baseline = seedValidator.baseline(seed, evaluator);
    } catch (EvaluatorUnavailableException e) {
      logger.atSevere().withCause(e).log("Evaluator unavailable before generation 0");
      return result
          .setFrontier(ParetoFrontier.of(ImmutableList.of()))
          .setStatus(RunStatus.ABORTED)
          .setMessage(e.getMessage())
          .build();
    }

    Run run =
        new Run(genetic, ObjectiveVectorFunction.create(config.objectives(), baseline));
    RunStatus status;
    try {
      status = RandomRegistry.with(random, r -> run.evolve(seed));
    } catch (EvaluatorUnavailableException e) {
      logger.atSevere().withCause(e).log(
          "Evaluator unavailable after %d generations; keeping frontier so far", run.generations);
      status = RunStatus.ABORTED;
      result.setMessage(e.getMessage());
    }

    ParetoFrontier frontier = ParetoFrontier.of(run.parents);
    FailureMonitor failures = run.populationEvaluator.failureMonitor();
    logger.atInfo().log(
        "Multi-objective search %s after %d generations: %d frontier members",
        status, run.generations, frontier.size());
    return result
        .setBaseline(baseline)
        .setFrontier(frontier)
        .setStatus(status)
        .setGenerations(run.generations)
        .setHistory(run.history.history())
        .setEvaluations(failures.evaluations() + 1)
        .setFailedEvaluations(failures.failures())
        .build();
  }

  /** State of one search. The parents are always fully scored, ranked and crowded. */
  private final class Run {
    private final GeneticConfig genetic;
    private final PopulationEvaluator populationEvaluator;
    private final ConvergenceTracker convergence;
    private final Population history = new Population();
    private final Map<Long, ObjectiveVector> pendingObjectives = new HashMap<>();
    private final Map<Long, ParetoIndividual> members = new HashMap<>();
    private final Map<Long, Phenotype<AllocationGene, Double>> phenotypes = new HashMap<>();
    private List<ParetoIndividual> parents = new ArrayList<>();
    private int generations;

    Run(GeneticConfig genetic, ObjectiveVectorFunction vectors) {
      this.genetic = genetic;
      this.convergence =
          ConvergenceTracker.create(genetic.convergenceWindow(), genetic.convergenceEpsilon());
      this.populationEvaluator =
          PopulationEvaluator.create(
              evaluator,
              constraints,
              new FailureMonitor(),
              (individual, evaluation, penalty) -> {
                ObjectiveVector vector = vectors.vector(evaluation, penalty);
                pendingObjectives.put(individual.id(), vector);
                individual.assignFitness(Stats.meanOf(vector.values()), penalty, evaluation);
              });
    }

    RunStatus evolve(Allocation seed) {
      AllocationMutator mutator =
          AllocationMutator.create(
              constraints,
              genetic.minAllocationSize(),
              genetic.optimizeMasteries(),
              genetic.mutationRate());
      UnionCrossover crossover =
          UnionCrossover.create(
              constraints,
              ConnectivityRepairer.create(constraints.graph()),
              genetic.unionInclusionProbability(),
              genetic.crossoverRate());
      Alterer<AllocationGene, Double> alterer = Alterer.of(crossover, mutator);
      Comparator<Phenotype<AllocationGene, Double>> crowded =
          Comparator.comparing(this::member, CrowdedComparator.INSTANCE);
      TournamentSelector<AllocationGene, Double> selector =
          new TournamentSelector<>(crowded, genetic.tournamentSize());

      parents =
          score(
              PopulationInitializer.create(
                      constraints, mutator, seed, genetic.initialVariationMaxChanges())
                  .initialize(genetic.populationSize())
                  .stream()
                  .map(gene -> Phenotype.<AllocationGene, Double>of(genotype(gene), 0))
                  .collect(ISeq.toISeq()));
      for (ImmutableList<ParetoIndividual> front : NonDominatedSorter.sort(parents)) {
        CrowdingDistance.assign(front);
      }
      history.initialize(unwrap(parents));
      while (true) {
        GenerationStats stats = history.record();
        generations++;
        logger.atInfo().log(
            "Generation %d: frontier %d, best mean score %.2f",
            history.generation(), countFrontier(parents), stats.best());
        if (convergence.update(history.bestEver().orElseThrow().fitness())) {
          return RunStatus.CONVERGED;
        }
        if (generations >= genetic.maxGenerations()) {
          return RunStatus.COMPLETED;
        }

        long generation = history.generation() + 1;
        ISeq<Phenotype<AllocationGene, Double>> selected =
            selector.select(phenotypesOf(parents), genetic.populationSize(), Optimize.MAXIMUM);
        // Unaltered copies of a parent are already in the combined population.
        ISeq<Phenotype<AllocationGene, Double>> offspring =
            alterer.alter(selected, generation).population().stream()
                .filter(Phenotype::nonEvaluated)
                .collect(ISeq.toISeq());

        List<ParetoIndividual> combined = new ArrayList<>(parents);
        combined.addAll(score(offspring));
        parents = survivors(combined, genetic.populationSize());
        retain(parents);
        history.advance(unwrap(parents));
      }
    }

    private List<ParetoIndividual> score(ISeq<Phenotype<AllocationGene, Double>> pending) {
      List<ParetoIndividual> scored = new ArrayList<>(pending.size());
      for (Phenotype<AllocationGene, Double> phenotype : populationEvaluator.eval(pending)) {
        Individual individual = populationEvaluator.individual(phenotype);
        ParetoIndividual member =
            ParetoIndividual.scored(individual, pendingObjectives.remove(individual.id()));
        members.put(individual.id(), member);
        phenotypes.put(individual.id(), phenotype);
        scored.add(member);
      }
      return scored;
    }

    private ParetoIndividual member(Phenotype<AllocationGene, Double> phenotype) {
      return members.get(geneOf(phenotype).id());
    }

    private ISeq<Phenotype<AllocationGene, Double>> phenotypesOf(List<ParetoIndividual> group) {
      return group.stream()
          .map(member -> phenotypes.get(member.individual().id()))
          .collect(ISeq.toISeq());
    }

    private void retain(List<ParetoIndividual> survivors) {
      Set<Long> ids = new HashSet<>();
      survivors.forEach(member -> ids.add(member.individual().id()));
      members.keySet().retainAll(ids);
      phenotypes.keySet().retainAll(ids);
      populationEvaluator.retain(phenotypesOf(survivors));
    }
  }

  /** Environmental selection: whole fronts while they fit, then the most isolated members. */
  static List<ParetoIndividual> survivors(List<ParetoIndividual> combined, int size) {
    List<ParetoIndividual> next = new ArrayList<>(size);
    for (ImmutableList<ParetoIndividual> front : NonDominatedSorter.sort(combined)) {
      CrowdingDistance.assign(front);
      if (next.size() + front.size() <= size) {
        next.addAll(front);
        continue;
      }
      List<ParetoIndividual> partial = new ArrayList<>(front);
      partial.sort(CrowdedComparator.INSTANCE.reversed());
      next.addAll(partial.subList(0, size - next.size()));
      break;
    }
    return next;
  }

  private static long countFrontier(List<ParetoIndividual> population) {
    return population.stream().filter(member -> member.rank() == 0).count();
  }

  private static ImmutableList<Individual> unwrap(List<ParetoIndividual> members) {
    return members.stream()
        .map(ParetoIndividual::individual)
        .collect(ImmutableList.toImmutableList());
  }
}
