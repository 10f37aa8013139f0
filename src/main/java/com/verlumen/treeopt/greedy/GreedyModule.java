package com.verlumen.treeopt.greedy;

import com.google.inject.AbstractModule;

public final class GreedyModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(GreedyOptimizer.class).to(GreedyOptimizerImpl.class);
  }
}
