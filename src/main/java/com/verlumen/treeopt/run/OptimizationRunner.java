package com.verlumen.treeopt.run;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.verlumen.treeopt.evaluation.Evaluator;
import com.verlumen.treeopt.evaluation.WorkerPool;
import com.verlumen.treeopt.evaluation.WorkerPoolHealthMonitor;
import com.verlumen.treeopt.genetic.GeneticConfig;
import com.verlumen.treeopt.genetic.GeneticOptimizationResult;
import com.verlumen.treeopt.genetic.GeneticOptimizer;
import com.verlumen.treeopt.greedy.GreedyConfig;
import com.verlumen.treeopt.greedy.GreedyOptimizer;
import com.verlumen.treeopt.greedy.GreedyResult;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.pareto.MultiObjectiveConfig;
import com.verlumen.treeopt.pareto.MultiObjectiveOptimizer;
import com.verlumen.treeopt.pareto.MultiObjectiveResult;

/**
 * Owns the worker pool for one optimization run. {@link #start()} brings the workers up and
 * schedules health checks; {@link #close()} stops both. Optimizers may be run any number of times
 * in between and share the evaluation cache.
 */
public final class OptimizationRunner implements AutoCloseable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final WorkerPool pool;
  private final WorkerPoolHealthMonitor healthMonitor;
  private final Evaluator evaluator;
  private final GreedyOptimizer greedyOptimizer;
  private final GeneticOptimizer geneticOptimizer;
  private final MultiObjectiveOptimizer multiObjectiveOptimizer;
  private boolean started;
  private boolean closed;

  @Inject
  OptimizationRunner(
      WorkerPool pool,
      WorkerPoolHealthMonitor healthMonitor,
      Evaluator evaluator,
      GreedyOptimizer greedyOptimizer,
      GeneticOptimizer geneticOptimizer,
      MultiObjectiveOptimizer multiObjectiveOptimizer) {
    this.pool = pool;
    this.healthMonitor = healthMonitor;
    this.evaluator = evaluator;
    this.greedyOptimizer = greedyOptimizer;
    this.geneticOptimizer = geneticOptimizer;
    this.multiObjectiveOptimizer = multiObjectiveOptimizer;
  }

  public static OptimizationRunner create(Module... modules) {
    return Guice.createInjector(modules).getInstance(OptimizationRunner.class);
  }

  /**
   * @throws com.verlumen.treeopt.evaluation.EvaluatorUnavailableException if no worker starts
   */
  public synchronized void start() {
    checkState(!closed, "Runner has been closed");
    if (started) {
      return;
    }
    int ready = pool.start();
    healthMonitor.start();
    started = true;
    logger.atInfo().log("Optimization runner started with %d ready workers", ready);
  }

  public GreedyResult runGreedy(Allocation seed, GreedyConfig config) {
    checkStarted();
    return greedyOptimizer.optimize(seed, config);
  }

  public GeneticOptimizationResult runGenetic(Allocation seed, GeneticConfig config) {
    checkStarted();
    return geneticOptimizer.optimize(seed, config);
  }

  public MultiObjectiveResult runMultiObjective(Allocation seed, MultiObjectiveConfig config) {
    checkStarted();
    return multiObjectiveOptimizer.optimize(seed, config);
  }

  public WorkerPool.Stats poolStats() {
    return pool.stats();
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (healthMonitor.isRunning()) {
      healthMonitor.stop();
    }
    // Closing the evaluator also closes the pool it wraps.
    evaluator.close();
    pool.close();
    logger.atInfo().log("Optimization runner closed: %s", pool.stats());
  }

  private synchronized void checkStarted() {
    checkState(started && !closed, "Runner is not running");
  }
}
