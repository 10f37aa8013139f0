package com.verlumen.treeopt.run;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.evaluation.EvaluationModule;
import com.verlumen.treeopt.evaluation.WorkerPoolConfig;
import com.verlumen.treeopt.genetic.GeneticModule;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.greedy.GreedyModule;
import com.verlumen.treeopt.pareto.ParetoModule;
import io.jenetics.util.RandomRegistry;
import java.util.random.RandomGenerator;

/**
 * Top-level module for one optimization run. The graph and constraints are fixed for the lifetime
 * of the injector; the worker pool is created from {@code poolConfig}.
 */
@AutoValue
public abstract class OptimizerModule extends AbstractModule {
  public static OptimizerModule create(
      ConstraintSet constraints, WorkerPoolConfig poolConfig) {
    return new AutoValue_OptimizerModule(constraints, poolConfig);
  }

  abstract ConstraintSet constraints();

  abstract WorkerPoolConfig poolConfig();

  @Override
  protected void configure() {
    install(EvaluationModule.create(poolConfig()));
    install(new GreedyModule());
    install(new GeneticModule());
    install(new ParetoModule());
  }

  @Provides
  ConstraintSet provideConstraintSet() {
    return constraints();
  }

  @Provides
  TreeGraph provideTreeGraph() {
    return constraints().graph();
  }

  @Provides
  RandomGenerator provideRandomGenerator() {
    return RandomRegistry.random();
  }
}
