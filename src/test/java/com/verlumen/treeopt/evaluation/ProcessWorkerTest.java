package com.verlumen.treeopt.evaluation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assume.assumeTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.treeopt.model.Allocation;
import java.io.File;
import java.time.Duration;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Drives real {@code /bin/sh} children that speak the worker line protocol. */
@RunWith(JUnit4.class)
public class ProcessWorkerTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);
  private static final Allocation ALLOCATION = Allocation.of(1, ImmutableSet.of(1, 2, 3));

  /** Answers every request with its own id, printing a debug line first. */
  private static final String ECHO_WORKER =
      "echo 'starting up'\n"
          + "echo '{\"ready\": true}'\n"
          + "while IFS= read -r line; do\n"
          + "  case \"$line\" in\n"
          + "    PING) echo '{\"pong\": true}' ;;\n"
          + "    EXIT) exit 0 ;;\n"
          + "    *) id=$(echo \"$line\" | sed 's/.*\"id\":\\([0-9]*\\).*/\\1/')\n"
          + "       echo 'computing'\n"
          + "       echo \"{\\\"id\\\": $id, \\\"success\\\": true,"
          + " \\\"metrics\\\": {\\\"dps\\\": 12.5}}\" ;;\n"
          + "  esac\n"
          + "done\n";

  /** Sends a stale response before the real one. */
  private static final String STALE_WORKER =
      "echo '{\"ready\": true}'\n"
          + "while IFS= read -r line; do\n"
          + "  case \"$line\" in\n"
          + "    EXIT) exit 0 ;;\n"
          + "    *) id=$(echo \"$line\" | sed 's/.*\"id\":\\([0-9]*\\).*/\\1/')\n"
          + "       echo '{\"id\": 999999, \"success\": true, \"metrics\": {\"dps\": 1}}'\n"
          + "       echo \"{\\\"id\\\": $id, \\\"success\\\": true,"
          + " \\\"metrics\\\": {\\\"dps\\\": 2}}\" ;;\n"
          + "  esac\n"
          + "done\n";

  /** Reads requests but never answers them. */
  private static final String SILENT_WORKER =
      "echo '{\"ready\": true}'\n"
          + "while IFS= read -r line; do\n"
          + "  if [ \"$line\" = EXIT ]; then exit 0; fi\n"
          + "done\n";

  /** Exits as soon as a request arrives. */
  private static final String CRASHING_WORKER =
      "echo '{\"ready\": true}'\n" + "read -r line\n" + "exit 3\n";

  /** Never announces readiness. */
  private static final String MUTE_WORKER = "sleep 30\n";

  private ProcessWorker worker;

  @Before
  public void assumeShell() {
    assumeTrue(new File("/bin/sh").canExecute());
  }

  @After
  public void stopWorker() {
    if (worker != null) {
      worker.stop();
    }
  }

  @Test
  public void start_readySignal_isAlive() {
    worker = create(ECHO_WORKER);

    assertThat(worker.start()).isTrue();
    assertThat(worker.isAlive()).isTrue();
  }

  @Test
  public void evaluate_skipsDebugOutputAndReadsResponse() {
    // Arrange
    worker = create(ECHO_WORKER);
    worker.start();

    // Act
    EvaluationResult result = worker.evaluate(EvaluationRequest.create(41, ALLOCATION), TIMEOUT);

    // Assert
    assertThat(result.success()).isTrue();
    assertThat(result.metricsOrThrow().get(Metric.DPS).getAsDouble()).isEqualTo(12.5);
  }

  @Test
  public void evaluate_consecutiveRequests_stayInStep() {
    worker = create(ECHO_WORKER);
    worker.start();

    for (long id = 1; id <= 5; id++) {
      assertThat(worker.evaluate(EvaluationRequest.create(id, ALLOCATION), TIMEOUT).success())
          .isTrue();
    }
  }

  @Test
  public void evaluate_staleResponse_isDiscarded() {
    worker = create(STALE_WORKER);
    worker.start();

    EvaluationResult result = worker.evaluate(EvaluationRequest.create(5, ALLOCATION), TIMEOUT);

    assertThat(result.metricsOrThrow().get(Metric.DPS).getAsDouble()).isEqualTo(2.0);
  }

  @Test
  public void evaluate_noAnswer_timesOutAndMarksWorkerDead() {
    // Arrange
    worker = create(SILENT_WORKER);
    worker.start();

    // Act
    EvaluationResult result =
        worker.evaluate(EvaluationRequest.create(1, ALLOCATION), Duration.ofMillis(300));

    // Assert
    assertThat(result.failedWith(FailureKind.TIMEOUT)).isTrue();
    assertThat(worker.isAlive()).isFalse();
  }

  @Test
  public void evaluate_processExits_reportsWorkerDied() {
    worker = create(CRASHING_WORKER);
    worker.start();

    EvaluationResult result = worker.evaluate(EvaluationRequest.create(1, ALLOCATION), TIMEOUT);

    assertThat(result.failedWith(FailureKind.WORKER_DIED)).isTrue();
    assertThat(worker.isAlive()).isFalse();
  }

  @Test
  public void evaluate_notStarted_reportsNotReady() {
    worker = create(ECHO_WORKER);

    EvaluationResult result = worker.evaluate(EvaluationRequest.create(1, ALLOCATION), TIMEOUT);

    assertThat(result.failedWith(FailureKind.NOT_READY)).isTrue();
  }

  @Test
  public void start_noReadySignal_failsAfterStartupTimeout() {
    worker =
        new ProcessWorker(
            WorkerCommand.builder()
                .setCommand(ImmutableList.of("/bin/sh", "-c", MUTE_WORKER))
                .setStartupTimeout(Duration.ofMillis(300))
                .build(),
            0);

    assertThat(worker.start()).isFalse();
    assertThat(worker.isAlive()).isFalse();
  }

  @Test
  public void ping_answeredWithPong() {
    worker = create(ECHO_WORKER);
    worker.start();

    assertThat(worker.ping(TIMEOUT)).isTrue();
  }

  @Test
  public void restart_afterCrash_isAliveAgain() {
    // Arrange
    worker = create(CRASHING_WORKER);
    worker.start();
    worker.evaluate(EvaluationRequest.create(1, ALLOCATION), TIMEOUT);

    // Act
    boolean restarted = worker.restart();

    // Assert
    assertThat(restarted).isTrue();
    assertThat(worker.isAlive()).isTrue();
  }

  @Test
  public void stop_exitsGracefully() {
    worker = create(ECHO_WORKER);
    worker.start();

    worker.stop();

    assertThat(worker.isAlive()).isFalse();
  }

  private static ProcessWorker create(String script) {
    return new ProcessWorker(WorkerCommand.of("/bin/sh", "-c", script), 0);
  }
}
