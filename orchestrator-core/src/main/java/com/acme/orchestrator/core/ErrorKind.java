package com.acme.orchestrator.core;

/** Failure classification driving retry decisions. */
public enum ErrorKind {
  /** Temporary failure (availability, contention, resource exhaustion). */
  TRANSIENT,
  /** Failure that will not go away on retry (invalid input, not found, business rule). */
  PERMANENT,
  /** Execution exceeded its deadline. Retried like a transient failure. */
  TIMEOUT;

  public boolean isRetryable() {
    return this != PERMANENT;
  }
}
