package com.verlumen.treeopt.evaluation;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.verlumen.treeopt.model.Allocation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link Evaluator} that spreads requests over a fixed set of persistent {@link Worker}s.
 *
 * <p>Requests go round-robin to the next idle worker and queue while every live worker is busy.
 * A worker that times out or dies is stopped, marked dead, and the request is retried once on a
 * different worker. When no worker is left alive the call fails with {@link
 * EvaluatorUnavailableException}. {@link #healthCheck()} brings dead workers back.
 *
 * <p>The pool lock guards slot bookkeeping only. Worker exchanges, restarts and pings all run
 * outside it, on a slot the calling thread has reserved.
 */
public final class WorkerPool implements Evaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final Duration PING_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  enum SlotState {
    STARTING,
    IDLE,
    BUSY,
    DEAD
  }

  private static final class Slot {
    final Worker worker;
    SlotState state = SlotState.STARTING;

    Slot(Worker worker) {
      this.worker = worker;
    }
  }

  private final WorkerPoolConfig config;
  private final ImmutableList<Slot> slots;
  private final ListeningExecutorService executor;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition slotReleased = lock.newCondition();
  private final AtomicLong nextRequestId = new AtomicLong();
  private final AtomicLong evaluations = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();
  private final AtomicLong retries = new AtomicLong();

  private int cursor;
  private boolean started;
  private boolean closed;

  @Inject
  WorkerPool(Worker.Factory workerFactory, WorkerPoolConfig config) {
    this.config = config;
    ImmutableList.Builder<Slot> builder = ImmutableList.builder();
    for (int i = 0; i < config.poolSize(); i++) {
      builder.add(new Slot(workerFactory.create(i)));
    }
    this.slots = builder.build();
    ThreadFactory threadFactory =
        new ThreadFactoryBuilder().setNameFormat("worker-pool-%d").setDaemon(true).build();
    this.executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(config.poolSize(), threadFactory));
  }

  /**
   * Starts every worker concurrently and returns how many became ready.
   *
   * @throws EvaluatorUnavailableException if none did
   */
  public int start() {
    logger.atInfo().log("Starting %d workers", slots.size());
    List<ListenableFuture<Boolean>> launches = new ArrayList<>();
    for (Slot slot : slots) {
      launches.add(executor.submit(() -> slot.worker.start()));
    }
    int ready = 0;
    lock.lock();
    try {
      for (int i = 0; i < slots.size(); i++) {
        boolean ok = launched(slots.get(i), launches.get(i));
        slots.get(i).state = ok ? SlotState.IDLE : SlotState.DEAD;
        if (ok) {
          ready++;
        }
      }
      started = true;
      slotReleased.signalAll();
    } finally {
      lock.unlock();
    }
    if (ready == 0) {
      throw new EvaluatorUnavailableException("No worker started out of " + slots.size());
    }
    logger.atInfo().log("Worker pool ready: %d/%d workers", ready, slots.size());
    return ready;
  }

  private static boolean launched(Slot slot, ListenableFuture<Boolean> launch) {
    try {
      return Futures.getUnchecked(launch);
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Worker %d failed to start", slot.worker.id());
      return false;
    }
  }

  @Override
  public EvaluationResult evaluate(Allocation allocation, Duration timeout) {
    checkState(started, "Worker pool has not been started");
    // Without exclusions acquire either returns a slot or throws.
    Slot first = acquire(ImmutableSet.of()).orElseThrow();
    EvaluationResult result = dispatch(first, allocation, timeout);
    if (!isWorkerFault(result)) {
      return result;
    }
    retries.incrementAndGet();
    Optional<Slot> second = acquire(ImmutableSet.of(first));
    if (second.isEmpty()) {
      logger.atWarning().log("No other worker to retry on: %s", result.error());
      return result;
    }
    return dispatch(second.get(), allocation, timeout);
  }

  @Override
  public ImmutableList<EvaluationResult> evaluateAll(
      List<Allocation> allocations, Duration timeout) {
    List<ListenableFuture<EvaluationResult>> futures = new ArrayList<>();
    for (Allocation allocation : allocations) {
      futures.add(executor.submit(() -> evaluate(allocation, timeout)));
    }
    try {
      return ImmutableList.copyOf(Futures.allAsList(futures).get());
    } catch (ExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      Throwables.throwIfUnchecked(e.getCause());
      throw new EvaluatorUnavailableException("Batch evaluation failed", e.getCause());
    } catch (InterruptedException e) {
      futures.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new EvaluatorUnavailableException("Interrupted while evaluating batch", e);
    }
  }

  @Override
  public Duration defaultTimeout() {
    return config.evaluationTimeout();
  }

  /**
   * Restarts dead workers and pings idle ones, restarting those that do not answer. Busy workers
   * are left alone.
   *
   * <p>Slots are checked one at a time and only the slot being pinged or restarted is reserved, so
   * requests keep flowing to the other workers during a slow ping.
   */
  public HealthReport healthCheck() {
    int dead = 0;
    int restarted = 0;
    int restartFailures = 0;
    for (Slot slot : slots) {
      SlotState found = reserveForCheck(slot);
      if (found == SlotState.IDLE) {
        if (pingQuietly(slot)) {
          release(slot, SlotState.IDLE);
          continue;
        }
        logger.atWarning().log("Worker %d is unresponsive", slot.worker.id());
      } else if (found != SlotState.DEAD) {
        continue;
      }
      dead++;
      if (restartQuietly(slot)) {
        restarted++;
        release(slot, SlotState.IDLE);
      } else {
        restartFailures++;
        release(slot, SlotState.DEAD);
      }
    }

    HealthReport report =
        HealthReport.create(slots.size(), aliveCount(), dead, restarted, restartFailures);
    if (restartFailures > 0) {
      logger.atWarning().log("Health check: %s", report);
    } else {
      logger.atFine().log("Health check: %s", report);
    }
    return report;
  }

  /**
   * Reserves {@code slot} for a ping when idle or for a restart when dead, and returns the state
   * it was found in.
   */
  private SlotState reserveForCheck(Slot slot) {
    lock.lock();
    try {
      SlotState found = slot.state;
      if (found == SlotState.IDLE) {
        slot.state = SlotState.BUSY;
      } else if (found == SlotState.DEAD) {
        slot.state = SlotState.STARTING;
      }
      return found;
    } finally {
      lock.unlock();
    }
  }

  /** Workers that are idle, busy or being restarted. */
  public int aliveCount() {
    lock.lock();
    try {
      return (int) slots.stream().filter(slot -> slot.state != SlotState.DEAD).count();
    } finally {
      lock.unlock();
    }
  }

  public Stats stats() {
    return Stats.create(
        slots.size(), aliveCount(), evaluations.get(), failures.get(), retries.get());
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      slotReleased.signalAll();
    } finally {
      lock.unlock();
    }
    logger.atInfo().log("Shutting down worker pool: %s", stats());
    MoreExecutors.shutdownAndAwaitTermination(executor, SHUTDOWN_TIMEOUT);
    for (Slot slot : slots) {
      slot.worker.stop();
    }
  }

  private EvaluationResult dispatch(Slot slot, Allocation allocation, Duration timeout) {
    EvaluationRequest request =
        EvaluationRequest.create(nextRequestId.incrementAndGet(), allocation);
    EvaluationResult result;
    try {
      result = slot.worker.evaluate(request, timeout);
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Worker %d threw during evaluation", slot.worker.id());
      result = EvaluationResult.failure(FailureKind.WORKER_DIED, String.valueOf(e.getMessage()));
    }
    evaluations.incrementAndGet();
    if (!result.success()) {
      failures.incrementAndGet();
    }
    if (isWorkerFault(result)) {
      logger.atWarning().log(
          "Worker %d marked dead after %s: %s",
          slot.worker.id(), result.failureKind().get(), result.error());
      // Stopped while still reserved, so a concurrent health check cannot have restarted it.
      slot.worker.stop();
      release(slot, SlotState.DEAD);
    } else {
      release(slot, SlotState.IDLE);
    }
    return result;
  }

  /**
   * Reserves the next idle worker not in {@code excluded}, waiting while all candidates are busy.
   * Empty when every live worker is excluded.
   */
  private Optional<Slot> acquire(Set<Slot> excluded) {
    lock.lock();
    try {
      while (true) {
        if (closed) {
          throw new EvaluatorUnavailableException("Worker pool is closed");
        }
        boolean anyLive = false;
        boolean anyCandidate = false;
        for (int i = 0; i < slots.size(); i++) {
          int index = (cursor + i) % slots.size();
          Slot slot = slots.get(index);
          if (slot.state == SlotState.DEAD) {
            continue;
          }
          anyLive = true;
          if (excluded.contains(slot)) {
            continue;
          }
          anyCandidate = true;
          if (slot.state == SlotState.IDLE) {
            slot.state = SlotState.BUSY;
            cursor = (index + 1) % slots.size();
            return Optional.of(slot);
          }
        }
        if (!anyLive) {
          logger.atSevere().log("All %d workers are dead", slots.size());
          throw new EvaluatorUnavailableException("All " + slots.size() + " workers are dead");
        }
        if (!anyCandidate) {
          return Optional.empty();
        }
        slotReleased.await();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EvaluatorUnavailableException("Interrupted while waiting for a worker", e);
    } finally {
      lock.unlock();
    }
  }

  private void release(Slot slot, SlotState state) {
    lock.lock();
    try {
      slot.state = state;
      slotReleased.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private static boolean pingQuietly(Slot slot) {
    try {
      return slot.worker.ping(PING_TIMEOUT);
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Ping of worker %d failed", slot.worker.id());
      return false;
    }
  }

  private static boolean restartQuietly(Slot slot) {
    try {
      return slot.worker.restart();
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Restart of worker %d failed", slot.worker.id());
      return false;
    }
  }

  private static boolean isWorkerFault(EvaluationResult result) {
    return result.failureKind().map(FailureKind::isWorkerFault).orElse(false);
  }

  /** Counters since the pool was created. */
  @AutoValue
  public abstract static class Stats {
    static Stats create(int poolSize, int alive, long evaluations, long failures, long retries) {
      return new AutoValue_WorkerPool_Stats(poolSize, alive, evaluations, failures, retries);
    }

    public abstract int poolSize();

    public abstract int alive();

    public abstract long evaluations();

    public abstract long failures();

    public abstract long retries();
  }
}
