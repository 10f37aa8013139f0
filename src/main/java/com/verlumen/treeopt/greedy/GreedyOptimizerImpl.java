package com.verlumen.treeopt.greedy;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import com.verlumen.treeopt.evaluation.Evaluator;
import com.verlumen.treeopt.evaluation.EvaluatorUnavailableException;
import com.verlumen.treeopt.evolution.FailureMonitor;
import com.verlumen.treeopt.evolution.SeedValidator;
import com.verlumen.treeopt.fitness.Baseline;
import com.verlumen.treeopt.fitness.FitnessFunction;
import com.verlumen.treeopt.greedy.CandidateGenerator.Candidate;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.RunStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Hill climbing: each iteration evaluates a bounded neighbourhood of the current allocation in
 * one batch and applies the single best strictly improving change. When no node change improves,
 * a second pass tries every alternative effect of each allocated mastery.
 */
final class GreedyOptimizerImpl implements GreedyOptimizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Evaluator evaluator;
  private final ConstraintSet constraints;
  private final RandomGenerator random;

  @Inject
  GreedyOptimizerImpl(Evaluator evaluator, ConstraintSet constraints, RandomGenerator random) {
    this.evaluator = evaluator;
    this.constraints = constraints;
    this.random = random;
  }

  @Override
  public GreedyResult optimize(Allocation seed, GreedyConfig config) {
    SeedValidator seedValidator = SeedValidator.create(constraints);
    seedValidator.validate(seed);
    logger.atInfo().log(
        "Starting local search for %s from %d points", config.objective(), seed.pointCount());

    GreedyResult.Builder result = GreedyResult.builder().setSeed(seed);
    Baseline baseline;
    try {
      baseline = seedValidator.baseline(seed, evaluator);
    } catch (EvaluatorUnavailableException e) {
      logger.atSevere().withCause(e).log("Evaluator unavailable before the first iteration");
      return result
          .setBest(seed)
          .setBestFitness(FitnessFunction.FAILED_FITNESS)
          .setSeedFitness(FitnessFunction.FAILED_FITNESS)
          .setStatus(RunStatus.ABORTED)
          .setMessage(e.getMessage())
          .build();
    }

    Search search = new Search(seed, FitnessFunction.create(config.objective(), baseline), config);
    search.run();
    if (search.status == RunStatus.ABORTED) {
      result.setMessage(search.message);
    }
    return result
        .setBaseline(baseline)
        .setBest(search.current)
        .setBestFitness(search.currentFitness)
        .setSeedFitness(search.seedFitness)
        .setStatus(search.status)
        .setMoves(ImmutableList.copyOf(search.moves))
        .setFitnessHistory(ImmutableList.copyOf(search.history))
        .setIterations(search.iterations)
        .setEvaluations(search.failureMonitor.evaluations() + 1)
        .setFailedEvaluations(search.failureMonitor.failures())
        .build();
  }

  /** State of one run. */
  private final class Search {
    final FitnessFunction fitness;
    final GreedyConfig config;
    final CandidateGenerator generator;
    final FailureMonitor failureMonitor = new FailureMonitor();
    final List<Move> moves = new ArrayList<>();
    final List<Double> history = new ArrayList<>();
    final double seedFitness;

    Allocation current;
    double currentFitness;
    int iterations;
    RunStatus status = RunStatus.COMPLETED;
    String message = "";

    Search(Allocation seed, FitnessFunction fitness, GreedyConfig config) {
      this.fitness = fitness;
      this.config = config;
      this.generator = new CandidateGenerator(constraints, random);
      this.current = seed;
      this.seedFitness =
          fitness.penalized(
              EvaluationResult.success(fitness.baseline().metrics()),
              constraints.penalty(seed));
      this.currentFitness = seedFitness;
    }

    void run() {
      try {
        climbNodes();
        if (config.optimizeMasteries()) {
          tuneMasteries();
        }
      } catch (EvaluatorUnavailableException e) {
        logger.atSevere().withCause(e).log("Evaluator unavailable; keeping best so far");
        status = RunStatus.ABORTED;
        message = e.getMessage();
      }
      logger.atInfo().log(
          "Local search %s after %d iterations: fitness %.2f -> %.2f with %d moves",
          status, iterations, seedFitness, currentFitness, moves.size());
    }

    private void climbNodes() {
      while (iterations < config.maxIterations()) {
        ImmutableList<Candidate> candidates = generator.nodeMoves(current, config);
        if (candidates.isEmpty()) {
          logger.atInfo().log("No candidates left at iteration %d", iterations);
          status = RunStatus.CONVERGED;
          return;
        }
        Optional<Scored> best = bestImprovement(candidates, iterations);
        if (best.isEmpty()) {
          logger.atInfo().log("No improving change at iteration %d", iterations);
          status = RunStatus.CONVERGED;
          return;
        }
        iterations++;
        apply(best.get());
      }
    }

    private void tuneMasteries() {
      for (int node : current.nodes()) {
        if (!constraints.graph().metadata(node).isMastery()) {
          continue;
        }
        ImmutableList<Candidate> candidates = generator.masteryMoves(current, node);
        if (!candidates.isEmpty()) {
          bestImprovement(candidates, iterations).ifPresent(this::apply);
        }
      }
    }

    private Optional<Scored> bestImprovement(ImmutableList<Candidate> candidates, int round) {
      ImmutableList<EvaluationResult> results =
          evaluator.evaluateAll(
              candidates.stream()
                  .map(candidate -> candidate.admission().allocation())
                  .collect(ImmutableList.toImmutableList()));
      int failures = 0;
      Scored best = null;
      for (int i = 0; i < candidates.size(); i++) {
        EvaluationResult evaluation = results.get(i);
        if (!evaluation.success()) {
          failures++;
        }
        Candidate candidate = candidates.get(i);
        double score = fitness.penalized(evaluation, candidate.admission().penalty());
        if (score <= currentFitness + config.minImprovement()) {
          continue;
        }
        Scored scored = new Scored(candidate, score);
        if (best == null || scored.beats(best)) {
          best = scored;
        }
      }
      failureMonitor.record(round, candidates.size(), failures);
      return Optional.ofNullable(best);
    }

    private void apply(Scored scored) {
      logger.atInfo().log(
          "Applied %s: fitness %.2f -> %.2f",
          scored.candidate.move(), currentFitness, scored.score);
      current = scored.candidate.admission().allocation();
      currentFitness = scored.score;
      moves.add(scored.candidate.move());
      history.add(scored.score);
    }
  }

  private static final class Scored {
    final Candidate candidate;
    final double score;

    Scored(Candidate candidate, double score) {
      this.candidate = candidate;
      this.score = score;
    }

    boolean beats(Scored other) {
      if (score != other.score) {
        return score > other.score;
      }
      return Move.TIE_BREAK.compare(candidate.move(), other.candidate.move()) < 0;
    }
  }
}
