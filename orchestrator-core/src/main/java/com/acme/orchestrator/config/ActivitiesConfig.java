package com.acme.orchestrator.config;

import java.time.Duration;

/**
 * Settings for the standard activity pipeline: retry, timeout and circuit breaker. Pure POJO - no
 * framework dependencies.
 */
public class ActivitiesConfig {

  private int retryMaxAttempts = 3;
  private Duration retryInitialBackoff = Duration.ofMillis(100);
  private Duration retryMaxBackoff = Duration.ofSeconds(30);
  private double retryBackoffMultiplier = 2.0;
  private Duration timeout = Duration.ofSeconds(30);
  private boolean circuitBreakerEnabled = true;
  private double circuitBreakerThreshold = 0.5;
  private Duration circuitBreakerTimeout = Duration.ofSeconds(10);
  private int circuitBreakerMinRequests = 3;

  public int getRetryMaxAttempts() {
    return retryMaxAttempts;
  }

  public void setRetryMaxAttempts(int retryMaxAttempts) {
    this.retryMaxAttempts = retryMaxAttempts;
  }

  public Duration getRetryInitialBackoff() {
    return retryInitialBackoff;
  }

  public void setRetryInitialBackoff(Duration retryInitialBackoff) {
    this.retryInitialBackoff = retryInitialBackoff;
  }

  public Duration getRetryMaxBackoff() {
    return retryMaxBackoff;
  }

  public void setRetryMaxBackoff(Duration retryMaxBackoff) {
    this.retryMaxBackoff = retryMaxBackoff;
  }

  public double getRetryBackoffMultiplier() {
    return retryBackoffMultiplier;
  }

  public void setRetryBackoffMultiplier(double retryBackoffMultiplier) {
    this.retryBackoffMultiplier = retryBackoffMultiplier;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public boolean isCircuitBreakerEnabled() {
    return circuitBreakerEnabled;
  }

  public void setCircuitBreakerEnabled(boolean circuitBreakerEnabled) {
    this.circuitBreakerEnabled = circuitBreakerEnabled;
  }

  public double getCircuitBreakerThreshold() {
    return circuitBreakerThreshold;
  }

  public void setCircuitBreakerThreshold(double circuitBreakerThreshold) {
    this.circuitBreakerThreshold = circuitBreakerThreshold;
  }

  /** Cool-down while open; also the length of the closed-state counting window. */
  public Duration getCircuitBreakerTimeout() {
    return circuitBreakerTimeout;
  }

  public void setCircuitBreakerTimeout(Duration circuitBreakerTimeout) {
    this.circuitBreakerTimeout = circuitBreakerTimeout;
  }

  public int getCircuitBreakerMinRequests() {
    return circuitBreakerMinRequests;
  }

  public void setCircuitBreakerMinRequests(int circuitBreakerMinRequests) {
    this.circuitBreakerMinRequests = circuitBreakerMinRequests;
  }
}
