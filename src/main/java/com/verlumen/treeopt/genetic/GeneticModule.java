package com.verlumen.treeopt.genetic;

import com.google.inject.AbstractModule;

/** Wires the genetic optimizer in the Guice DI context. */
public final class GeneticModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(GeneticOptimizer.class).to(GeneticOptimizerImpl.class);
  }
}
