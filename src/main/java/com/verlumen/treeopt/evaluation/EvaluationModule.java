package com.verlumen.treeopt.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/** Binds the worker pool, its health monitor and the {@link Evaluator} optimizers consume. */
@AutoValue
public abstract class EvaluationModule extends AbstractModule {
  public static EvaluationModule create(WorkerPoolConfig config) {
    return new AutoValue_EvaluationModule(config);
  }

  abstract WorkerPoolConfig config();

  @Override
  protected void configure() {
    install(
        new FactoryModuleBuilder()
            .implement(Worker.class, ProcessWorker.class)
            .build(Worker.Factory.class));
    bind(WorkerPool.class).in(Singleton.class);
    bind(WorkerPoolHealthMonitor.class).in(Singleton.class);
  }

  @Provides
  WorkerPoolConfig provideWorkerPoolConfig() {
    return config();
  }

  @Provides
  WorkerCommand provideWorkerCommand() {
    return config().workerCommand();
  }

  @Provides
  @Singleton
  Evaluator provideEvaluator(WorkerPool pool) {
    if (!config().cachingEnabled()) {
      return pool;
    }
    return CachingEvaluator.create(pool, config().cacheMaximumSize());
  }

  @Provides
  ScheduledExecutorService provideHealthCheckScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("worker-health-%d").setDaemon(true).build());
  }
}
