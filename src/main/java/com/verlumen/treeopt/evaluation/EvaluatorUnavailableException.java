package com.verlumen.treeopt.evaluation;

/** No worker can take requests any more. Fatal to the run that observes it. */
public final class EvaluatorUnavailableException extends RuntimeException {
  public EvaluatorUnavailableException(String message) {
    super(message);
  }

  public EvaluatorUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
