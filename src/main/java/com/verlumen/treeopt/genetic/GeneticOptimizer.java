package com.verlumen.treeopt.genetic;

import com.verlumen.treeopt.model.Allocation;

/** Population-based search for the allocation maximizing one objective. */
public interface GeneticOptimizer {
  /**
   * @throws com.verlumen.treeopt.model.InvalidSeedException if the seed is invalid or cannot be
   *     evaluated
   */
  GeneticOptimizationResult optimize(Allocation seed, GeneticConfig config);
}
