package com.verlumen.treeopt.run;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.util.Modules;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.constraints.PointBudget;
import com.verlumen.treeopt.evaluation.Worker;
import com.verlumen.treeopt.evaluation.WorkerCommand;
import com.verlumen.treeopt.evaluation.WorkerPoolConfig;
import com.verlumen.treeopt.fitness.Objective;
import com.verlumen.treeopt.genetic.GeneticConfig;
import com.verlumen.treeopt.genetic.GeneticOptimizationResult;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.greedy.GreedyConfig;
import com.verlumen.treeopt.greedy.GreedyResult;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.RunStatus;
import com.verlumen.treeopt.pareto.MultiObjectiveConfig;
import com.verlumen.treeopt.pareto.MultiObjectiveResult;
import com.verlumen.treeopt.testing.TestGraphs;
import java.time.Duration;
import java.util.SplittableRandom;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OptimizationRunnerTest {
  private final TreeGraph graph = TestGraphs.random(120, 40, new SplittableRandom(31));
  private final Allocation seed = TestGraphs.breadthFirst(graph, 0, 25);
  private final ConstraintSet constraints =
      ConstraintSet.builder(graph).setPointBudget(PointBudget.atMost(30)).build();
  private final WorkerPoolConfig poolConfig =
      WorkerPoolConfig.builder()
          .setPoolSize(3)
          .setEvaluationTimeout(Duration.ofSeconds(5))
          .setHealthCheckInterval(Duration.ofMinutes(10))
          .setWorkerCommand(WorkerCommand.of("unused"))
          .build();

  private OptimizationRunner runner;

  @Before
  public void setUp() {
    runner =
        OptimizationRunner.create(
            Modules.override(OptimizerModule.create(constraints, poolConfig))
                .with(
                    new AbstractModule() {
                      @Override
                      protected void configure() {
                        bind(Worker.Factory.class).toInstance(ScoringWorker::new);
                      }
                    }));
  }

  @After
  public void tearDown() {
    runner.close();
  }

  @Test
  public void runGreedy_beforeStart_throws() {
    assertThrows(
        IllegalStateException.class, () -> runner.runGreedy(seed, GreedyConfig.defaults()));
  }

  @Test
  public void start_bringsUpEveryWorker() {
    runner.start();

    assertThat(runner.poolStats().poolSize()).isEqualTo(3);
    assertThat(runner.poolStats().alive()).isEqualTo(3);
  }

  @Test
  public void runGreedy_improvesWithinBudget() {
    runner.start();

    GreedyResult result =
        runner.runGreedy(seed, GreedyConfig.builder().setObjective(Objective.LIFE).build());

    assertThat(result.bestFitness()).isGreaterThan(result.seedFitness());
    assertThat(result.best().pointCount()).isAtMost(30);
    assertThat(result.status()).isEqualTo(RunStatus.CONVERGED);
  }

  @Test
  public void runGenetic_sharesThePool() {
    runner.start();

    GeneticOptimizationResult result =
        runner.runGenetic(
            seed,
            GeneticConfig.builder()
                .setPopulationSize(10)
                .setElitismCount(2)
                .setMaxGenerations(4)
                .build());

    assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
    assertThat(result.generations()).isEqualTo(4);
    assertThat(runner.poolStats().evaluations()).isGreaterThan(0L);
    assertThat(runner.poolStats().failures()).isEqualTo(0L);
  }

  @Test
  public void runMultiObjective_returnsFrontier() {
    runner.start();

    MultiObjectiveResult result =
        runner.runMultiObjective(
            seed,
            MultiObjectiveConfig.builder()
                .setGenetic(
                    GeneticConfig.builder().setPopulationSize(10).setMaxGenerations(3).build())
                .setObjectives(ImmutableList.of(Objective.DPS, Objective.EHP))
                .build());

    assertThat(result.frontier().isEmpty()).isFalse();
  }

  @Test
  public void close_isIdempotentAndStopsFurtherRuns() {
    runner.start();

    runner.close();
    runner.close();

    assertThrows(
        IllegalStateException.class, () -> runner.runGreedy(seed, GreedyConfig.defaults()));
    assertThrows(IllegalStateException.class, () -> runner.start());
  }
}
