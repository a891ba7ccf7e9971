package com.acme.orchestrator.pipeline;

import com.acme.orchestrator.breaker.CircuitBreaker;
import com.acme.orchestrator.breaker.CircuitBreakerMiddleware;
import com.acme.orchestrator.telemetry.ActivityLogger;
import com.acme.orchestrator.telemetry.MetricsCollector;
import io.opentelemetry.api.trace.Tracer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/** Composes activity middleware into a single {@link ActivityFunction}. */
public final class ActivityPipeline {

  private ActivityPipeline() {}

  /**
   * Wraps {@code fn} with the given middleware. The first middleware is the outermost one: it sees
   * the call first and the outcome last.
   */
  public static ActivityFunction apply(ActivityFunction fn, ActivityMiddleware... middlewares) {
    return apply(fn, List.of(middlewares));
  }

  public static ActivityFunction apply(ActivityFunction fn, List<ActivityMiddleware> middlewares) {
    ActivityFunction wrapped = Objects.requireNonNull(fn, "fn");
    for (int i = middlewares.size() - 1; i >= 0; i--) {
      wrapped = middlewares.get(i).wrap(wrapped);
    }
    return wrapped;
  }

  public static Builder builder(String activityName) {
    return new Builder(activityName);
  }

  /**
   * Builds the standard chain, outermost first: tracing, logging, timeout, retry, circuit breaker,
   * error classification. Stages that are not configured are left out; classification is always
   * present so that retry decisions see classified errors.
   */
  public static final class Builder {
    private final String activityName;
    private Tracer tracer;
    private ActivityLogger logger;
    private MetricsCollector metrics;
    private Duration timeout;
    private Executor timeoutExecutor;
    private RetryPolicy retryPolicy;
    private CircuitBreaker circuitBreaker;

    private Builder(String activityName) {
      this.activityName = Objects.requireNonNull(activityName, "activityName");
    }

    public Builder tracing(Tracer tracer) {
      this.tracer = tracer;
      return this;
    }

    public Builder logging(ActivityLogger logger, MetricsCollector metrics) {
      this.logger = logger;
      this.metrics = metrics;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder timeout(Duration timeout, Executor executor) {
      this.timeout = timeout;
      this.timeoutExecutor = executor;
      return this;
    }

    public Builder retry(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    public ActivityFunction build(ActivityFunction fn) {
      return apply(fn, middlewares());
    }

    List<ActivityMiddleware> middlewares() {
      List<ActivityMiddleware> chain = new ArrayList<>();
      if (tracer != null) {
        chain.add(new TracingMiddleware(tracer, activityName));
      }
      if (logger != null) {
        chain.add(new LoggingMiddleware(logger, metrics, activityName));
      }
      if (timeout != null) {
        chain.add(
            timeoutExecutor != null
                ? new TimeoutMiddleware(timeout, timeoutExecutor)
                : new TimeoutMiddleware(timeout));
      }
      if (retryPolicy != null) {
        chain.add(new RetryMiddleware(retryPolicy));
      }
      if (circuitBreaker != null) {
        chain.add(new CircuitBreakerMiddleware(circuitBreaker));
      }
      chain.add(new ErrorClassificationMiddleware());
      return chain;
    }
  }
}
