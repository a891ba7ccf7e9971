package com.acme.orchestrator.breaker;

import com.acme.orchestrator.config.ActivitiesConfig;
import com.acme.orchestrator.core.TransientException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-fast guard for one named operation.
 *
 * <ul>
 *   <li>CLOSED: calls pass through. Requests and failures are counted per {@code interval} window;
 *       the breaker opens once at least {@code minimumRequests} were seen and the failure ratio
 *       reaches {@code failureThreshold}.
 *   <li>OPEN: calls are rejected with a transient {@code CIRCUIT_BREAKER_OPEN} error until {@code
 *       openTimeout} has passed.
 *   <li>HALF_OPEN: a single probe call is admitted. Success closes the breaker, failure reopens it.
 *       Other calls are rejected while the probe runs.
 * </ul>
 *
 * Outcomes of calls admitted before the last state change are ignored.
 */
public class CircuitBreaker {
  private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

  public static final String CIRCUIT_BREAKER_OPEN = "CIRCUIT_BREAKER_OPEN";
  public static final int DEFAULT_MINIMUM_REQUESTS = 3;

  public enum State {
    CLOSED,
    OPEN,
    HALF_OPEN
  }

  private final String name;
  private final double failureThreshold;
  private final int minimumRequests;
  private final Duration interval;
  private final Duration openTimeout;
  private final Clock clock;

  private State state = State.CLOSED;
  private long generation;
  private int requests;
  private int failures;
  private boolean probeInFlight;
  private Instant windowEnd;
  private Instant openUntil;

  /** Breaker whose counting window and cool-down are both {@code timeout}. */
  public CircuitBreaker(String name, double failureThreshold, Duration timeout) {
    this(name, failureThreshold, DEFAULT_MINIMUM_REQUESTS, timeout, timeout, Clock.systemUTC());
  }

  public CircuitBreaker(
      String name,
      double failureThreshold,
      int minimumRequests,
      Duration interval,
      Duration openTimeout,
      Clock clock) {
    if (failureThreshold <= 0.0 || failureThreshold > 1.0) {
      throw new IllegalArgumentException(
          "failureThreshold must be in (0, 1], was " + failureThreshold);
    }
    if (minimumRequests < 1) {
      throw new IllegalArgumentException("minimumRequests must be >= 1, was " + minimumRequests);
    }
    this.name = Objects.requireNonNull(name, "name");
    this.failureThreshold = failureThreshold;
    this.minimumRequests = minimumRequests;
    this.interval = Objects.requireNonNull(interval, "interval");
    this.openTimeout = Objects.requireNonNull(openTimeout, "openTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.windowEnd = nextWindowEnd(clock.instant());
  }

  public static CircuitBreaker from(String name, ActivitiesConfig config) {
    return new CircuitBreaker(
        name,
        config.getCircuitBreakerThreshold(),
        config.getCircuitBreakerMinRequests(),
        config.getCircuitBreakerTimeout(),
        config.getCircuitBreakerTimeout(),
        Clock.systemUTC());
  }

  public String getName() {
    return name;
  }

  public synchronized State getState() {
    refresh(clock.instant());
    return state;
  }

  /**
   * Runs {@code work} if the breaker admits it.
   *
   * @throws TransientException with code {@code CIRCUIT_BREAKER_OPEN} if the call is rejected
   */
  public <T> T execute(Supplier<T> work) {
    long ticket = beforeCall();
    T result;
    try {
      result = work.get();
    } catch (RuntimeException | Error e) {
      afterCall(ticket, false);
      throw e;
    }
    afterCall(ticket, true);
    return result;
  }

  private synchronized long beforeCall() {
    refresh(clock.instant());
    switch (state) {
      case OPEN -> throw rejection();
      case HALF_OPEN -> {
        if (probeInFlight) {
          throw rejection();
        }
        probeInFlight = true;
      }
      case CLOSED -> {
        // admitted
      }
    }
    requests++;
    return generation;
  }

  private synchronized void afterCall(long ticket, boolean success) {
    Instant now = clock.instant();
    refresh(now);
    if (ticket != generation) {
      return;
    }
    if (state == State.HALF_OPEN) {
      transition(success ? State.CLOSED : State.OPEN, now);
      return;
    }
    if (!success) {
      failures++;
      if (requests >= minimumRequests && (double) failures / requests >= failureThreshold) {
        transition(State.OPEN, now);
      }
    }
  }

  private void refresh(Instant now) {
    if (state == State.CLOSED && windowEnd != null && !now.isBefore(windowEnd)) {
      newGeneration(now);
    } else if (state == State.OPEN && !now.isBefore(openUntil)) {
      transition(State.HALF_OPEN, now);
    }
  }

  private void transition(State to, Instant now) {
    State from = state;
    state = to;
    if (to == State.OPEN) {
      openUntil = now.plus(openTimeout);
      LOG.warn(
          "Circuit breaker {} changed from {} to {} (failures={}, requests={})",
          name,
          from,
          to,
          failures,
          requests);
    } else {
      LOG.info("Circuit breaker {} changed from {} to {}", name, from, to);
    }
    newGeneration(now);
  }

  private void newGeneration(Instant now) {
    generation++;
    requests = 0;
    failures = 0;
    probeInFlight = false;
    windowEnd = state == State.CLOSED ? nextWindowEnd(now) : null;
  }

  private Instant nextWindowEnd(Instant now) {
    return interval.isZero() || interval.isNegative() ? null : now.plus(interval);
  }

  private TransientException rejection() {
    return new TransientException(
        CIRCUIT_BREAKER_OPEN, "circuit breaker open for activity: " + name);
  }
}
