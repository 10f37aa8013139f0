package com.verlumen.treeopt.testing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.treeopt.evaluation.EvaluationMetrics;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import com.verlumen.treeopt.evaluation.Evaluator;
import com.verlumen.treeopt.evaluation.EvaluatorUnavailableException;
import com.verlumen.treeopt.evaluation.FailureKind;
import com.verlumen.treeopt.evaluation.Metric;
import com.verlumen.treeopt.model.Allocation;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Deterministic in-process evaluator. Every node carries fixed per-metric weights and an
 * allocation scores the sum of its nodes' weights. DPS favours low ids and LIFE favours high ids,
 * so the two pull in different directions.
 */
public final class FakeEvaluator implements Evaluator {
  private final AtomicInteger calls = new AtomicInteger();
  private final AtomicBoolean unavailable = new AtomicBoolean();
  private volatile Predicate<Allocation> failing = allocation -> false;
  private volatile int unavailableAfter = Integer.MAX_VALUE;

  public static double dpsWeight(int node) {
    return 1 + (node * 7919) % 13;
  }

  public static double lifeWeight(int node) {
    return 1 + (node * 104729) % 11 + node / 20.0;
  }

  public static double dps(Allocation allocation) {
    return allocation.nodes().stream().mapToDouble(FakeEvaluator::dpsWeight).sum()
        + allocation.masterySelections().values().stream().mapToInt(effect -> effect % 3).sum();
  }

  public static double life(Allocation allocation) {
    return allocation.nodes().stream().mapToDouble(FakeEvaluator::lifeWeight).sum();
  }

  /** Allocations matching {@code predicate} come back as rejected evaluations. */
  public FakeEvaluator failWhen(Predicate<Allocation> predicate) {
    this.failing = predicate;
    return this;
  }

  /** Throws {@link EvaluatorUnavailableException} once {@code calls} evaluations have happened. */
  public FakeEvaluator unavailableAfter(int calls) {
    this.unavailableAfter = calls;
    return this;
  }

  public int calls() {
    return calls.get();
  }

  @Override
  public EvaluationResult evaluate(Allocation allocation, Duration timeout) {
    if (unavailable.get() || calls.get() >= unavailableAfter) {
      unavailable.set(true);
      throw new EvaluatorUnavailableException("All 1 workers are dead");
    }
    calls.incrementAndGet();
    if (failing.test(allocation)) {
      return EvaluationResult.failure(FailureKind.REJECTED, "rejected by test");
    }
    double life = life(allocation);
    Map<Metric, Double> metrics =
        ImmutableMap.of(
            Metric.DPS, dps(allocation),
            Metric.LIFE, life,
            Metric.EHP, life * 1.5 + allocation.pointCount());
    return EvaluationResult.success(EvaluationMetrics.of(metrics));
  }

  @Override
  public ImmutableList<EvaluationResult> evaluateAll(
      List<Allocation> allocations, Duration timeout) {
    ImmutableList.Builder<EvaluationResult> results = ImmutableList.builder();
    for (Allocation allocation : allocations) {
      results.add(evaluate(allocation, timeout));
    }
    return results.build();
  }

  @Override
  public Duration defaultTimeout() {
    return Duration.ofSeconds(1);
  }

  @Override
  public void close() {}
}
