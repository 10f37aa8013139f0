package com.verlumen.treeopt.fitness;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import com.verlumen.treeopt.evaluation.EvaluationMetrics;
import com.verlumen.treeopt.evaluation.Metric;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BaselineTest {
  private final Baseline baseline =
      Baseline.of(
          EvaluationMetrics.of(
              ImmutableMap.of(Metric.DPS, 200.0, Metric.LIFE, 0.0, Metric.BLOCK, -50.0)));

  @Test
  public void percentChange_relativeToBaseline() {
    assertThat(baseline.percentChange(Metric.DPS, 250.0).getAsDouble()).isEqualTo(25.0);
    assertThat(baseline.percentChange(Metric.DPS, 100.0).getAsDouble()).isEqualTo(-50.0);
  }

  @Test
  public void percentChange_negativeBaseline_usesMagnitude() {
    assertThat(baseline.percentChange(Metric.BLOCK, -25.0).getAsDouble()).isEqualTo(50.0);
  }

  @Test
  public void percentChange_zeroBaseline() {
    assertThat(baseline.percentChange(Metric.LIFE, 0.0).getAsDouble()).isEqualTo(0.0);
    assertThat(baseline.percentChange(Metric.LIFE, 30.0).getAsDouble()).isEqualTo(100.0);
    assertThat(baseline.percentChange(Metric.LIFE, -30.0).getAsDouble()).isEqualTo(-100.0);
  }

  @Test
  public void percentChange_metricMissingFromBaseline_isEmpty() {
    assertThat(baseline.percentChange(Metric.MANA, 10.0).isPresent()).isFalse();
  }
}
