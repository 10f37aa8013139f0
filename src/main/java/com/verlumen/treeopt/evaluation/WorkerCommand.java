package com.verlumen.treeopt.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/** How to launch one evaluator worker process. */
@AutoValue
public abstract class WorkerCommand {
  static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(30);

  public static WorkerCommand of(String... command) {
    return builder().setCommand(ImmutableList.copyOf(command)).build();
  }

  public static Builder builder() {
    return new AutoValue_WorkerCommand.Builder().setStartupTimeout(DEFAULT_STARTUP_TIMEOUT);
  }

  public abstract ImmutableList<String> command();

  public abstract Optional<Path> workingDirectory();

  /** How long a fresh process may take to announce it is ready. */
  public abstract Duration startupTimeout();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setCommand(ImmutableList<String> command);

    public abstract Builder setWorkingDirectory(Path workingDirectory);

    public abstract Builder setStartupTimeout(Duration startupTimeout);

    public abstract WorkerCommand build();
  }
}
