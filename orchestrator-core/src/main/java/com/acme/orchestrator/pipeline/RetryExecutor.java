package com.acme.orchestrator.pipeline;

import com.acme.orchestrator.core.ErrorClassifier;
import com.acme.orchestrator.core.ErrorKind;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs work under a {@link RetryPolicy}. Permanent failures are rethrown at once; transient and
 * timeout failures are retried until attempts run out, and then the last failure is rethrown as is.
 */
public class RetryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryPolicy policy;

  public RetryExecutor(RetryPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public RetryPolicy getPolicy() {
    return policy;
  }

  /**
   * @throws CancellationException if the context is cancelled before an attempt or while waiting
   *     between attempts
   */
  public <T> T execute(ActivityContext context, Supplier<T> work) {
    RuntimeException lastError = null;
    for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
      if (context.isCancelled()) {
        throw new CancellationException("activity cancelled: " + context.getActivityName());
      }
      try {
        return work.get();
      } catch (CancellationException e) {
        throw e;
      } catch (RuntimeException e) {
        lastError = e;
        ErrorKind kind = ErrorClassifier.kindOf(e);
        if (!kind.isRetryable()) {
          LOG.debug(
              "Not retrying {} after permanent failure: {}",
              context.getActivityName(),
              e.getMessage());
          throw e;
        }
        if (attempt + 1 < policy.maxAttempts()) {
          Duration backoff = policy.backoffFor(attempt);
          LOG.debug(
              "Attempt {}/{} of {} failed ({}), retrying in {} ms: {}",
              attempt + 1,
              policy.maxAttempts(),
              context.getActivityName(),
              kind,
              backoff.toMillis(),
              e.getMessage());
          waitBeforeRetry(context, backoff);
        }
      }
    }
    LOG.warn(
        "Retries exhausted for {} after {} attempts: {}",
        context.getActivityName(),
        policy.maxAttempts(),
        lastError.getMessage());
    throw lastError;
  }

  private static void waitBeforeRetry(ActivityContext context, Duration backoff) {
    try {
      if (context.awaitCancellation(backoff)) {
        throw new CancellationException(
            "activity cancelled while waiting to retry: " + context.getActivityName());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException(
          "interrupted while waiting to retry: " + context.getActivityName());
    }
  }
}
