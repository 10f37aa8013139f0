package com.verlumen.treeopt.greedy;

import com.verlumen.treeopt.model.Allocation;

/** Single-objective hill climbing over one-node changes. */
public interface GreedyOptimizer {
  /**
   * @throws com.verlumen.treeopt.model.InvalidSeedException if the seed is invalid or cannot be
   *     evaluated
   */
  GreedyResult optimize(Allocation seed, GreedyConfig config);
}
