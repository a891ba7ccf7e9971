package com.acme.orchestrator.pipeline;

import com.acme.orchestrator.config.ActivitiesConfig;
import java.time.Duration;
import java.util.Objects;

/** Exponential backoff settings. */
public record RetryPolicy(
    int maxAttempts, Duration initialBackoff, Duration maxBackoff, double backoffMultiplier) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
    }
    Objects.requireNonNull(initialBackoff, "initialBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("backoff durations must not be negative");
    }
    if (backoffMultiplier < 1.0) {
      throw new IllegalArgumentException(
          "backoffMultiplier must be >= 1.0, was " + backoffMultiplier);
    }
  }

  /** 100 ms initial backoff, doubling up to 30 s. */
  public static RetryPolicy defaults(int maxAttempts) {
    return new RetryPolicy(maxAttempts, Duration.ofMillis(100), Duration.ofSeconds(30), 2.0);
  }

  public static RetryPolicy from(ActivitiesConfig config) {
    return new RetryPolicy(
        config.getRetryMaxAttempts(),
        config.getRetryInitialBackoff(),
        config.getRetryMaxBackoff(),
        config.getRetryBackoffMultiplier());
  }

  /** Wait before retrying after the failed attempt {@code attempt} (0-indexed). */
  public Duration backoffFor(int attempt) {
    double nanos = initialBackoff.toNanos() * Math.pow(backoffMultiplier, attempt);
    if (nanos >= maxBackoff.toNanos()) {
      return maxBackoff;
    }
    return Duration.ofNanos((long) nanos);
  }
}
