package com.verlumen.treeopt.evaluation;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link WorkerPool#healthCheck()} at the configured interval so that dead workers are
 * restarted instead of permanently shrinking the pool.
 */
public final class WorkerPoolHealthMonitor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  // Maximum time to wait for graceful shutdown
  private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final WorkerPool pool;
  private final WorkerPoolConfig config;
  private final ScheduledExecutorService scheduler;
  private boolean isRunning;

  @Inject
  WorkerPoolHealthMonitor(
      WorkerPool pool, WorkerPoolConfig config, ScheduledExecutorService scheduler) {
    this.pool = pool;
    this.config = config;
    this.scheduler = scheduler;
    this.isRunning = false;
  }

  public synchronized void start() {
    if (isRunning) {
      logger.atWarning().log("Health monitor is already running");
      return;
    }
    long intervalMillis = config.healthCheckInterval().toMillis();
    scheduler.scheduleAtFixedRate(
        this::checkHealth, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    isRunning = true;
    logger.atInfo().log("Worker pool health monitoring started (every %d ms)", intervalMillis);
  }

  /** Exceptions are logged so that the schedule keeps running. */
  void checkHealth() {
    try {
      HealthReport report = pool.healthCheck();
      if (report.dead() > 0) {
        logger.atInfo().log(
            "Health check restarted %d of %d unhealthy workers", report.restarted(), report.dead());
      }
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Error during worker pool health check");
    }
  }

  public synchronized void stop() {
    if (!isRunning) {
      logger.atWarning().log("Health monitor is not running");
      return;
    }
    logger.atInfo().log("Stopping worker pool health monitor");
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
    isRunning = false;
  }

  public synchronized boolean isRunning() {
    return isRunning;
  }
}
