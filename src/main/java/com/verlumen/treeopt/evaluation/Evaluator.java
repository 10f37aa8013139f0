package com.verlumen.treeopt.evaluation;

import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.model.Allocation;
import java.time.Duration;
import java.util.List;

/**
 * Turns allocations into metrics. Implementations are safe to call from several threads, and
 * calls are referentially transparent for a fixed allocation.
 *
 * <p>Per-allocation failures are returned as failed {@link EvaluationResult}s. {@link
 * EvaluatorUnavailableException} is thrown only when no evaluation can happen at all.
 */
public interface Evaluator extends AutoCloseable {
  EvaluationResult evaluate(Allocation allocation, Duration timeout);

  /** Evaluates concurrently where possible; results are in the order of {@code allocations}. */
  ImmutableList<EvaluationResult> evaluateAll(List<Allocation> allocations, Duration timeout);

  /** Timeout used by the single-argument overloads. */
  Duration defaultTimeout();

  default EvaluationResult evaluate(Allocation allocation) {
    return evaluate(allocation, defaultTimeout());
  }

  default ImmutableList<EvaluationResult> evaluateAll(List<Allocation> allocations) {
    return evaluateAll(allocations, defaultTimeout());
  }

  @Override
  void close();
}
