package com.acme.orchestrator.activity;

import com.acme.orchestrator.breaker.CircuitBreaker;
import com.acme.orchestrator.config.ActivitiesConfig;
import com.acme.orchestrator.core.PermanentException;
import com.acme.orchestrator.pipeline.ActivityContext;
import com.acme.orchestrator.pipeline.ActivityFunction;
import com.acme.orchestrator.pipeline.ActivityPipeline;
import com.acme.orchestrator.pipeline.RetryPolicy;
import com.acme.orchestrator.telemetry.ActivityLogger;
import com.acme.orchestrator.telemetry.MetricsCollector;
import io.opentelemetry.api.trace.Tracer;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of named activities. Each registered function is wrapped once with the standard pipeline
 * (logging, timeout, retry, circuit breaker, classification) built from {@link ActivitiesConfig}.
 */
public class ActivityRegistry {
  private static final Logger log = LoggerFactory.getLogger(ActivityRegistry.class);

  public static final String ACTIVITY_NOT_FOUND = "ACTIVITY_NOT_FOUND";

  private final ActivitiesConfig config;
  private final ActivityLogger activityLogger;
  private final MetricsCollector metrics;
  private final Tracer tracer;
  private final Map<String, ActivityFunction> activities = new ConcurrentHashMap<>();

  public ActivityRegistry(
      ActivitiesConfig config, ActivityLogger activityLogger, MetricsCollector metrics) {
    this(config, activityLogger, metrics, null);
  }

  /**
   * @param tracer when non-null, every activity also gets a tracing stage
   */
  public ActivityRegistry(
      ActivitiesConfig config,
      ActivityLogger activityLogger,
      MetricsCollector metrics,
      Tracer tracer) {
    this.config = config;
    this.activityLogger = activityLogger;
    this.metrics = metrics;
    this.tracer = tracer;
  }

  /**
   * Register an activity under a unique name
   *
   * @throws IllegalStateException if an activity is already registered under this name
   */
  public void register(String name, ActivityFunction activity) {
    ActivityFunction wrapped = pipelineFor(name).build(activity);
    if (activities.putIfAbsent(name, wrapped) != null) {
      String error = "Activity already registered: " + name;
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registered activity: {}", name);
  }

  /** Execute an activity with a fresh root context */
  public byte[] execute(String name, byte[] input) {
    return execute(name, ActivityContext.create(name), input);
  }

  public byte[] execute(String name, ActivityContext context, byte[] input) {
    ActivityFunction activity = activities.get(name);
    if (activity == null) {
      throw new PermanentException(ACTIVITY_NOT_FOUND, "no activity registered with name: " + name);
    }
    return activity.execute(context.forActivity(name), input);
  }

  public boolean contains(String name) {
    return activities.containsKey(name);
  }

  public Set<String> names() {
    return new TreeSet<>(activities.keySet());
  }

  private ActivityPipeline.Builder pipelineFor(String name) {
    ActivityPipeline.Builder builder =
        ActivityPipeline.builder(name)
            .tracing(tracer)
            .logging(activityLogger, metrics)
            .timeout(config.getTimeout())
            .retry(RetryPolicy.from(config));
    if (config.isCircuitBreakerEnabled()) {
      builder.circuitBreaker(CircuitBreaker.from(name, config));
    }
    return builder;
  }
}
