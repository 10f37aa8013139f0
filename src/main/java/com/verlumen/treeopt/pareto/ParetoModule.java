package com.verlumen.treeopt.pareto;

import com.google.inject.AbstractModule;

public final class ParetoModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(MultiObjectiveOptimizer.class).to(MultiObjectiveOptimizerImpl.class);
  }
}
