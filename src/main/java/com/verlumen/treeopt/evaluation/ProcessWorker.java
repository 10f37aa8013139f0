package com.verlumen.treeopt.evaluation;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * {@link Worker} backed by a child process speaking {@link WorkerProtocol} over stdin and stdout.
 *
 * <p>A daemon thread pumps stdout lines into a queue so that every read can be bounded by a
 * timeout; an empty element marks end of stream. Stderr is drained into fine-level logs.
 */
final class ProcessWorker implements Worker {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Duration EXIT_GRACE_PERIOD = Duration.ofSeconds(2);
  private static final Duration KILL_GRACE_PERIOD = Duration.ofSeconds(1);

  private final int workerId;
  private final WorkerCommand command;
  private final ThreadFactory threadFactory;
  private final ReentrantLock channelLock = new ReentrantLock();

  private volatile Process process;
  private volatile BlockingQueue<Optional<String>> lines;
  private volatile BufferedWriter stdin;
  private volatile boolean ready;
  private volatile boolean dead;

  @Inject
  ProcessWorker(WorkerCommand command, @Assisted int workerId) {
    this.workerId = workerId;
    this.command = command;
    this.threadFactory =
        new ThreadFactoryBuilder()
            .setNameFormat("worker-" + workerId + "-io-%d")
            .setDaemon(true)
            .build();
  }

  @Override
  public int id() {
    return workerId;
  }

  @Override
  public boolean start() {
    channelLock.lock();
    try {
      if (ready && !dead) {
        logger.atWarning().log("Worker %d already started", workerId);
        return true;
      }
      return launch();
    } finally {
      channelLock.unlock();
    }
  }

  private boolean launch() {
    ready = false;
    dead = false;
    ProcessBuilder builder = new ProcessBuilder(command.command());
    command.workingDirectory().ifPresent(path -> builder.directory(path.toFile()));
    long startNanos = System.nanoTime();
    try {
      process = builder.start();
    } catch (IOException e) {
      logger.atSevere().withCause(e).log(
          "Worker %d failed to launch %s", workerId, command.command());
      dead = true;
      return false;
    }
    BlockingQueue<Optional<String>> queue = new LinkedBlockingQueue<>();
    lines = queue;
    stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), UTF_8));
    pump(
        process.getInputStream(),
        line -> queue.add(Optional.of(line)),
        () -> queue.add(Optional.empty()));
    pump(
        process.getErrorStream(),
        line -> logger.atFine().log("Worker %d stderr: %s", workerId, line),
        () -> {});

    long deadline = startNanos + command.startupTimeout().toNanos();
    while (true) {
      Optional<Optional<String>> next = poll(queue, deadline);
      if (next.isEmpty()) {
        logger.atSevere().log("Worker %d startup timeout", workerId);
        break;
      }
      if (next.get().isEmpty()) {
        logger.atSevere().log("Worker %d exited during startup", workerId);
        break;
      }
      Optional<JsonObject> message = WorkerProtocol.parse(next.get().get());
      if (message.isPresent() && WorkerProtocol.isReady(message.get())) {
        ready = true;
        logger.atInfo().log(
            "Worker %d ready (startup: %d ms)",
            workerId, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return true;
      }
    }
    dead = true;
    destroy();
    return false;
  }

  @Override
  public EvaluationResult evaluate(EvaluationRequest request, Duration timeout) {
    if (!isAlive()) {
      return EvaluationResult.failure(FailureKind.NOT_READY, "Worker " + workerId + " not ready");
    }
    long deadline = System.nanoTime() + timeout.toNanos();
    channelLock.lock();
    try {
      if (!send(WorkerProtocol.encode(request))) {
        return EvaluationResult.failure(
            FailureKind.WORKER_DIED, "Worker " + workerId + " channel closed");
      }
      while (true) {
        Optional<Optional<String>> next = poll(lines, deadline);
        if (next.isEmpty()) {
          // The late response would arrive out of step with later requests.
          dead = true;
          return EvaluationResult.failure(
              FailureKind.TIMEOUT,
              String.format("Worker %d timed out after %d ms", workerId, timeout.toMillis()));
        }
        if (next.get().isEmpty()) {
          dead = true;
          return EvaluationResult.failure(
              FailureKind.WORKER_DIED, "Worker " + workerId + " exited");
        }
        Optional<JsonObject> message = WorkerProtocol.parse(next.get().get());
        if (message.isEmpty() || !WorkerProtocol.isResponse(message.get())) {
          continue;
        }
        OptionalLong id = WorkerProtocol.responseId(message.get());
        if (id.isPresent() && id.getAsLong() != request.requestId()) {
          logger.atFine().log(
              "Worker %d discarding stale response %d (want %d)",
              workerId, id.getAsLong(), request.requestId());
          continue;
        }
        return WorkerProtocol.decode(message.get());
      }
    } finally {
      channelLock.unlock();
    }
  }

  @Override
  public boolean ping(Duration timeout) {
    if (!isAlive()) {
      return false;
    }
    if (!channelLock.tryLock()) {
      // Busy with a request; that request's own timeout covers liveness.
      return true;
    }
    try {
      if (!send(WorkerProtocol.PING)) {
        return false;
      }
      long deadline = System.nanoTime() + timeout.toNanos();
      while (true) {
        Optional<Optional<String>> next = poll(lines, deadline);
        if (next.isEmpty() || next.get().isEmpty()) {
          return false;
        }
        Optional<JsonObject> message = WorkerProtocol.parse(next.get().get());
        if (message.isPresent() && WorkerProtocol.isPong(message.get())) {
          return true;
        }
      }
    } finally {
      channelLock.unlock();
    }
  }

  @Override
  public boolean restart() {
    logger.atInfo().log("Restarting worker %d", workerId);
    stop();
    channelLock.lock();
    try {
      return launch();
    } finally {
      channelLock.unlock();
    }
  }

  @Override
  public void stop() {
    Process current = process;
    ready = false;
    if (current == null || !current.isAlive()) {
      return;
    }
    try {
      stdin.write(WorkerProtocol.EXIT);
      stdin.newLine();
      stdin.flush();
      if (current.waitFor(EXIT_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.atInfo().log("Worker %d stopped", workerId);
        return;
      }
    } catch (IOException e) {
      logger.atFine().withCause(e).log("Worker %d channel already closed", workerId);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    destroy();
  }

  @Override
  public boolean isAlive() {
    Process current = process;
    return ready && !dead && current != null && current.isAlive();
  }

  private void destroy() {
    Process current = process;
    if (current == null) {
      return;
    }
    current.destroyForcibly();
    try {
      if (!current.waitFor(KILL_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.atWarning().log("Worker %d did not exit after kill", workerId);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private boolean send(String line) {
    try {
      stdin.write(line);
      stdin.newLine();
      stdin.flush();
      return true;
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Worker %d write failed", workerId);
      dead = true;
      return false;
    }
  }

  /** Empty when the deadline passed; otherwise the next line, or empty inner value at EOF. */
  private static Optional<Optional<String>> poll(
      BlockingQueue<Optional<String>> queue, long deadlineNanos) {
    long remaining = deadlineNanos - System.nanoTime();
    if (remaining <= 0) {
      return Optional.ofNullable(queue.poll());
    }
    try {
      return Optional.ofNullable(queue.poll(remaining, TimeUnit.NANOSECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  private void pump(InputStream stream, Consumer<String> onLine, Runnable onEnd) {
    threadFactory
        .newThread(
            () -> {
              try (BufferedReader reader =
                  new BufferedReader(new InputStreamReader(stream, UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                  onLine.accept(line);
                }
              } catch (IOException e) {
                logger.atFine().withCause(e).log("Worker %d stream closed", workerId);
              } finally {
                onEnd.run();
              }
            })
        .start();
  }
}
