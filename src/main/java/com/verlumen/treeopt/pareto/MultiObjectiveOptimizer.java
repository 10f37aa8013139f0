package com.verlumen.treeopt.pareto;

import com.verlumen.treeopt.model.Allocation;

/** Searches for the Pareto frontier of allocations over several objectives. */
public interface MultiObjectiveOptimizer {
  /**
   * @throws com.verlumen.treeopt.model.InvalidSeedException if the seed is invalid or cannot be
   *     evaluated
   */
  MultiObjectiveResult optimize(Allocation seed, MultiObjectiveConfig config);
}
