package com.verlumen.treeopt.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;

@AutoValue
public abstract class WorkerPoolConfig {
  static final Duration DEFAULT_EVALUATION_TIMEOUT = Duration.ofSeconds(30);
  static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);
  static final int DEFAULT_CACHE_MAXIMUM_SIZE = 10_000;

  public static Builder builder() {
    return new AutoValue_WorkerPoolConfig.Builder()
        .setPoolSize(Runtime.getRuntime().availableProcessors())
        .setEvaluationTimeout(DEFAULT_EVALUATION_TIMEOUT)
        .setHealthCheckInterval(DEFAULT_HEALTH_CHECK_INTERVAL)
        .setCachingEnabled(true)
        .setCacheMaximumSize(DEFAULT_CACHE_MAXIMUM_SIZE);
  }

  public abstract int poolSize();

  public abstract Duration evaluationTimeout();

  public abstract Duration healthCheckInterval();

  public abstract boolean cachingEnabled();

  public abstract long cacheMaximumSize();

  public abstract WorkerCommand workerCommand();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPoolSize(int poolSize);

    public abstract Builder setEvaluationTimeout(Duration evaluationTimeout);

    public abstract Builder setHealthCheckInterval(Duration healthCheckInterval);

    public abstract Builder setCachingEnabled(boolean cachingEnabled);

    public abstract Builder setCacheMaximumSize(long cacheMaximumSize);

    public abstract Builder setWorkerCommand(WorkerCommand workerCommand);

    abstract WorkerPoolConfig autoBuild();

    public WorkerPoolConfig build() {
      WorkerPoolConfig config = autoBuild();
      checkArgument(config.poolSize() > 0, "Pool size must be positive");
      checkArgument(!config.evaluationTimeout().isNegative(), "Timeout must not be negative");
      checkArgument(config.cacheMaximumSize() > 0, "Cache size must be positive");
      return config;
    }
  }
}
