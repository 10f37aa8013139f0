package com.verlumen.treeopt.fitness;

import com.google.common.collect.ImmutableMap;
import com.verlumen.treeopt.evaluation.Metric;

/** What an optimizer maximizes. Each objective weighs one or more metrics. */
public enum Objective {
  DPS(ImmutableMap.of(Metric.DPS, 1.0)),
  LIFE(ImmutableMap.of(Metric.LIFE, 1.0)),
  EHP(ImmutableMap.of(Metric.EHP, 1.0)),
  MANA(ImmutableMap.of(Metric.MANA, 1.0)),
  ENERGY_SHIELD(ImmutableMap.of(Metric.ENERGY_SHIELD, 1.0)),
  BLOCK(ImmutableMap.of(Metric.BLOCK, 1.0)),
  CLEAR_SPEED(ImmutableMap.of(Metric.CLEAR_SPEED, 1.0)),
  /** Equal-weight mean of the damage, life and effective health changes. */
  BALANCED(ImmutableMap.of(Metric.DPS, 1.0, Metric.LIFE, 1.0, Metric.EHP, 1.0));

  private final ImmutableMap<Metric, Double> weights;

  Objective(ImmutableMap<Metric, Double> weights) {
    this.weights = weights;
  }

  public ImmutableMap<Metric, Double> weights() {
    return weights;
  }
}
