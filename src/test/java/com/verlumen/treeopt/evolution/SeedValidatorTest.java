package com.verlumen.treeopt.evolution;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import com.verlumen.treeopt.constraints.ConstraintPolicy;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.constraints.PointBudget;
import com.verlumen.treeopt.evaluation.Metric;
import com.verlumen.treeopt.fitness.Baseline;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.InvalidSeedException;
import com.verlumen.treeopt.testing.FakeEvaluator;
import com.verlumen.treeopt.testing.TestGraphs;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SeedValidatorTest {
  private final TreeGraph graph = TestGraphs.chain(10);

  @Test
  public void validate_disconnectedSeed_throws() {
    SeedValidator validator = SeedValidator.create(ConstraintSet.unconstrained(graph));

    InvalidSeedException thrown =
        assertThrows(
            InvalidSeedException.class,
            () -> validator.validate(Allocation.of(0, ImmutableSet.of(0, 1, 5))));

    assertThat(thrown.problems()).hasSize(1);
  }

  @Test
  public void validate_unknownNode_throws() {
    SeedValidator validator = SeedValidator.create(ConstraintSet.unconstrained(graph));

    assertThrows(
        InvalidSeedException.class,
        () -> validator.validate(Allocation.of(0, ImmutableSet.of(0, 42))));
  }

  @Test
  public void validate_violationUnderHardReject_throws() {
    ConstraintSet constraints =
        ConstraintSet.builder(graph)
            .setPointBudget(PointBudget.atMost(2))
            .setPolicy(ConstraintPolicy.HARD_REJECT)
            .build();

    assertThrows(
        InvalidSeedException.class,
        () ->
            SeedValidator.create(constraints)
                .validate(Allocation.of(0, ImmutableSet.of(0, 1, 2, 3))));
  }

  @Test
  public void validate_violationUnderSoftPenalize_isAccepted() {
    ConstraintSet constraints =
        ConstraintSet.builder(graph)
            .setPointBudget(PointBudget.atMost(2))
            .setPolicy(ConstraintPolicy.SOFT_PENALIZE)
            .build();

    SeedValidator.create(constraints).validate(Allocation.of(0, ImmutableSet.of(0, 1, 2, 3)));
  }

  @Test
  public void baseline_measuresTheSeed() {
    Allocation seed = Allocation.of(0, ImmutableSet.of(0, 1, 2));

    Baseline baseline =
        SeedValidator.create(ConstraintSet.unconstrained(graph))
            .baseline(seed, new FakeEvaluator());

    assertThat(baseline.metrics().get(Metric.DPS).getAsDouble())
        .isEqualTo(FakeEvaluator.dps(seed));
  }

  @Test
  public void baseline_failedEvaluation_throws() {
    FakeEvaluator evaluator = new FakeEvaluator().failWhen(allocation -> true);

    assertThrows(
        InvalidSeedException.class,
        () ->
            SeedValidator.create(ConstraintSet.unconstrained(graph))
                .baseline(Allocation.of(0, ImmutableSet.of(0)), evaluator));
  }
}
