package com.verlumen.treeopt.evaluation;

import static com.google.common.truth.Truth.assertThat;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EvaluationModuleTest {
  private static final WorkerCommand COMMAND = WorkerCommand.of("/bin/sh", "-c", "exit 0");

  @Test
  public void evaluator_cachingEnabled_wrapsSingletonPool() {
    // Arrange
    WorkerPoolConfig config =
        WorkerPoolConfig.builder().setPoolSize(2).setWorkerCommand(COMMAND).build();
    Injector injector = Guice.createInjector(EvaluationModule.create(config));

    // Act
    Evaluator evaluator = injector.getInstance(Evaluator.class);

    // Assert
    assertThat(evaluator).isInstanceOf(CachingEvaluator.class);
    assertThat(injector.getInstance(Evaluator.class)).isSameInstanceAs(evaluator);
    assertThat(injector.getInstance(WorkerPool.class))
        .isSameInstanceAs(injector.getInstance(WorkerPool.class));
    evaluator.close();
  }

  @Test
  public void evaluator_cachingDisabled_isThePool() {
    // Arrange
    WorkerPoolConfig config =
        WorkerPoolConfig.builder()
            .setPoolSize(1)
            .setCachingEnabled(false)
            .setWorkerCommand(COMMAND)
            .build();
    Injector injector = Guice.createInjector(EvaluationModule.create(config));

    // Act
    Evaluator evaluator = injector.getInstance(Evaluator.class);

    // Assert
    assertThat(evaluator).isSameInstanceAs(injector.getInstance(WorkerPool.class));
    evaluator.close();
  }

  @Test
  public void workerFactory_createsProcessWorkersWithTheirIds() {
    WorkerPoolConfig config =
        WorkerPoolConfig.builder().setPoolSize(1).setWorkerCommand(COMMAND).build();
    Injector injector = Guice.createInjector(EvaluationModule.create(config));

    Worker worker = injector.getInstance(Worker.Factory.class).create(7);

    assertThat(worker).isInstanceOf(ProcessWorker.class);
    assertThat(worker.id()).isEqualTo(7);
    assertThat(worker.isAlive()).isFalse();
  }
}
