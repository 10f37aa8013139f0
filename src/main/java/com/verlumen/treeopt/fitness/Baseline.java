package com.verlumen.treeopt.fitness;

import com.google.auto.value.AutoValue;
import com.verlumen.treeopt.evaluation.EvaluationMetrics;
import com.verlumen.treeopt.evaluation.Metric;
import java.util.OptionalDouble;

/** Metrics of the seed allocation; every fitness is a change relative to these. */
@AutoValue
public abstract class Baseline {
  public static Baseline of(EvaluationMetrics metrics) {
    return new AutoValue_Baseline(metrics);
  }

  public abstract EvaluationMetrics metrics();

  /**
   * Percentage change of {@code value} against the baseline value of {@code metric}. A zero
   * baseline yields 0 for an unchanged value and plus or minus 100 otherwise. Empty when the
   * baseline lacks the metric.
   */
  public OptionalDouble percentChange(Metric metric, double value) {
    OptionalDouble base = metrics().get(metric);
    if (base.isEmpty()) {
      return OptionalDouble.empty();
    }
    double b = base.getAsDouble();
    if (b == 0.0) {
      return OptionalDouble.of(value == 0.0 ? 0.0 : Math.copySign(100.0, value));
    }
    return OptionalDouble.of(100.0 * (value - b) / Math.abs(b));
  }
}
