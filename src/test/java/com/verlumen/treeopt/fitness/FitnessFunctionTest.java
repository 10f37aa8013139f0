package com.verlumen.treeopt.fitness;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.treeopt.evaluation.EvaluationMetrics;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import com.verlumen.treeopt.evaluation.FailureKind;
import com.verlumen.treeopt.evaluation.Metric;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class FitnessFunctionTest {
  private static final Baseline BASELINE =
      Baseline.of(
          EvaluationMetrics.of(
              ImmutableMap.of(Metric.DPS, 100.0, Metric.LIFE, 1000.0, Metric.EHP, 2000.0)));

  @Test
  public void fitness_singleMetric_isPercentChange() {
    FitnessFunction fitness = FitnessFunction.create(Objective.DPS, BASELINE);

    assertThat(fitness.fitness(result(120.0, 1000.0, 2000.0))).isWithin(1e-9).of(20.0);
  }

  @Test
  public void fitness_balanced_isMeanOfChanges() {
    FitnessFunction fitness = FitnessFunction.create(Objective.BALANCED, BASELINE);

    // +30%, -10%, +10%
    assertThat(fitness.fitness(result(130.0, 900.0, 2200.0))).isWithin(1e-9).of(10.0);
  }

  @Test
  public void fitness_baselineItself_isZero(
      @TestParameter({"DPS", "LIFE", "EHP", "BALANCED"}) Objective objective) {
    FitnessFunction fitness = FitnessFunction.create(objective, BASELINE);

    assertThat(fitness.fitness(EvaluationResult.success(BASELINE.metrics()))).isEqualTo(0.0);
  }

  @Test
  public void fitness_failedEvaluation_isFailedSentinel() {
    FitnessFunction fitness = FitnessFunction.create(Objective.DPS, BASELINE);

    double score = fitness.fitness(EvaluationResult.failure(FailureKind.TIMEOUT, "slow"));

    assertThat(score).isEqualTo(FitnessFunction.FAILED_FITNESS);
    assertThat(FitnessFunction.isFailed(score)).isTrue();
  }

  @Test
  public void fitness_missingMetric_isFailedSentinel() {
    FitnessFunction fitness = FitnessFunction.create(Objective.LIFE, BASELINE);
    EvaluationResult dpsOnly =
        EvaluationResult.success(EvaluationMetrics.of(ImmutableMap.of(Metric.DPS, 1.0)));

    assertThat(fitness.fitness(dpsOnly)).isEqualTo(FitnessFunction.FAILED_FITNESS);
  }

  @Test
  public void penalized_subtractsPenaltyButKeepsFailuresAtSentinel() {
    FitnessFunction fitness = FitnessFunction.create(Objective.DPS, BASELINE);

    assertThat(fitness.penalized(result(110.0, 0.0, 0.0), 150.0)).isWithin(1e-9).of(-140.0);
    assertThat(fitness.penalized(EvaluationResult.failure(FailureKind.REJECTED, "no"), 150.0))
        .isEqualTo(FitnessFunction.FAILED_FITNESS);
  }

  @Test
  public void objectiveVector_scoresEachObjective() {
    ObjectiveVectorFunction vectors =
        ObjectiveVectorFunction.create(ImmutableList.of(Objective.DPS, Objective.LIFE), BASELINE);

    ObjectiveVector vector = vectors.vector(result(150.0, 500.0, 2000.0), 0.0);

    assertThat(vector.values()).containsExactly(50.0, -50.0).inOrder();
    assertThat(vectors.vector(EvaluationResult.failure(FailureKind.TIMEOUT, ""), 0.0).isFailed())
        .isTrue();
  }

  private static EvaluationResult result(double dps, double life, double ehp) {
    return EvaluationResult.success(
        EvaluationMetrics.of(ImmutableMap.of(Metric.DPS, dps, Metric.LIFE, life, Metric.EHP, ehp)));
  }
}
