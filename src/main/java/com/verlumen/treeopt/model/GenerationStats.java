package com.verlumen.treeopt.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.math.Quantiles;
import com.google.common.math.Stats;
import java.util.Arrays;
import java.util.Collection;

/** Fitness summary of one generation, as recorded in a run's history. */
@AutoValue
public abstract class GenerationStats {
  public static GenerationStats create(
      int generation, double best, double mean, double worst, double median, int failures) {
    return new AutoValue_GenerationStats(generation, best, mean, worst, median, failures);
  }

  /**
   * Summarizes the fitness values of evaluated individuals. Failed evaluations are counted but left
   * out of the statistics unless every evaluation failed.
   */
  public static GenerationStats of(int generation, Collection<Individual> individuals) {
    checkArgument(!individuals.isEmpty(), "Cannot summarize an empty generation");
    int failures = 0;
    double[] values = new double[individuals.size()];
    int count = 0;
    for (Individual individual : individuals) {
      if (individual.evaluationFailed()) {
        failures++;
        continue;
      }
      values[count++] = individual.fitness();
    }
    if (count == 0) {
      double failed = individuals.iterator().next().fitness();
      return create(generation, failed, failed, failed, failed, failures);
    }
    double[] kept = Arrays.copyOf(values, count);
    Stats stats = Stats.of(kept);
    return create(
        generation,
        stats.max(),
        stats.mean(),
        stats.min(),
        Quantiles.median().compute(kept),
        failures);
  }

  public abstract int generation();

  public abstract double best();

  public abstract double mean();

  public abstract double worst();

  public abstract double median();

  /** Number of individuals whose evaluation failed this generation. */
  public abstract int failures();
}
