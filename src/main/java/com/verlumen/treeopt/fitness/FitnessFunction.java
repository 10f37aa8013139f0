package com.verlumen.treeopt.fitness;

import com.verlumen.treeopt.evaluation.EvaluationMetrics;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import com.verlumen.treeopt.evaluation.Metric;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Scalar fitness of an evaluation for one {@link Objective}: the weighted mean percentage change of
 * the objective's metrics against the {@link Baseline}.
 */
public final class FitnessFunction {
  /** Fitness of a failed evaluation; below any score a real allocation can reach. */
  public static final double FAILED_FITNESS = -1.0e9;

  private final Objective objective;
  private final Baseline baseline;

  private FitnessFunction(Objective objective, Baseline baseline) {
    this.objective = objective;
    this.baseline = baseline;
  }

  public static FitnessFunction create(Objective objective, Baseline baseline) {
    return new FitnessFunction(objective, baseline);
  }

  public Objective objective() {
    return objective;
  }

  public Baseline baseline() {
    return baseline;
  }

  /** {@link #FAILED_FITNESS} when the evaluation failed or lacks a metric the objective needs. */
  public double fitness(EvaluationResult result) {
    if (!result.success()) {
      return FAILED_FITNESS;
    }
    EvaluationMetrics metrics = result.metricsOrThrow();
    double weighted = 0.0;
    double totalWeight = 0.0;
    for (Map.Entry<Metric, Double> weight : objective.weights().entrySet()) {
      OptionalDouble value = metrics.get(weight.getKey());
      if (value.isEmpty()) {
        return FAILED_FITNESS;
      }
      OptionalDouble change = baseline.percentChange(weight.getKey(), value.getAsDouble());
      if (change.isEmpty()) {
        return FAILED_FITNESS;
      }
      weighted += weight.getValue() * change.getAsDouble();
      totalWeight += weight.getValue();
    }
    return weighted / totalWeight;
  }

  /** Fitness reduced by a constraint penalty. Failed evaluations stay at the sentinel. */
  public double penalized(EvaluationResult result, double penalty) {
    double fitness = fitness(result);
    return isFailed(fitness) ? fitness : fitness - penalty;
  }

  public static boolean isFailed(double fitness) {
    return fitness <= FAILED_FITNESS;
  }
}
