package com.verlumen.treeopt.evaluation;

import java.time.Duration;

/**
 * One persistent evaluator process. A worker handles one request at a time; callers that share a
 * worker are serialized on its channel.
 */
public interface Worker {
  int id();

  /** Launches the process and waits for its ready signal. Returns whether it became ready. */
  boolean start();

  /** Never throws for per-request problems; they come back as failed results. */
  EvaluationResult evaluate(EvaluationRequest request, Duration timeout);

  /** True when the worker answered a ping in time, or is busy serving a request. */
  boolean ping(Duration timeout);

  /** Stops the process if it is running and starts a fresh one. */
  boolean restart();

  void stop();

  boolean isAlive();

  interface Factory {
    Worker create(int workerId);
  }
}
