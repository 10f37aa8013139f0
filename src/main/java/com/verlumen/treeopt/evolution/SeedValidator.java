package com.verlumen.treeopt.evolution;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.treeopt.constraints.ConstraintPolicy;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.constraints.ValidationResult;
import com.verlumen.treeopt.constraints.Violation;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import com.verlumen.treeopt.evaluation.Evaluator;
import com.verlumen.treeopt.fitness.Baseline;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.InvalidSeedException;

/** Checks a seed allocation before a run and measures the baseline every fitness refers to. */
public final class SeedValidator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ConstraintSet constraints;

  private SeedValidator(ConstraintSet constraints) {
    this.constraints = constraints;
  }

  public static SeedValidator create(ConstraintSet constraints) {
    return new SeedValidator(constraints);
  }

  /**
   * @throws InvalidSeedException if the seed has unknown nodes or is disconnected, or violates a
   *     constraint under the hard-reject policy
   */
  public void validate(Allocation seed) {
    ValidationResult result = constraints.validate(seed);
    if (result.ok()) {
      return;
    }
    if (result.hasStructuralViolation()) {
      throw new InvalidSeedException(
          "Seed allocation is invalid",
          result.violations().stream()
              .filter(Violation::isStructural)
              .map(Violation::message)
              .collect(ImmutableList.toImmutableList()));
    }
    if (constraints.policy() == ConstraintPolicy.HARD_REJECT) {
      throw new InvalidSeedException("Seed allocation violates constraints", result.messages());
    }
    logger.atWarning().log("Seed allocation violates constraints: %s", result.messages());
  }

  /**
   * Evaluates the seed.
   *
   * @throws InvalidSeedException if the evaluator cannot score the seed
   * @throws com.verlumen.treeopt.evaluation.EvaluatorUnavailableException if no worker is left
   */
  public Baseline baseline(Allocation seed, Evaluator evaluator) {
    EvaluationResult result = evaluator.evaluate(seed);
    if (!result.success()) {
      throw new InvalidSeedException("Seed allocation could not be evaluated: " + result.error());
    }
    logger.atInfo().log("Baseline metrics: %s", result.metricsOrThrow().values());
    return Baseline.of(result.metricsOrThrow());
  }
}
