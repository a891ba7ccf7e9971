package com.acme.orchestrator.config;

import com.acme.orchestrator.activity.ActivityRegistry;
import com.acme.orchestrator.otlp.OtlpReceiver;
import com.acme.orchestrator.otlp.OtlpReceiverServer;
import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.repository.LogRepository;
import com.acme.orchestrator.telemetry.ActivityLogger;
import com.acme.orchestrator.telemetry.MetricsCollector;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.inject.Singleton;

/** Wires the telemetry collaborators: metrics registry, activity logger, registry and receiver. */
@Factory
public class TelemetryBeansFactory {

  static final String INSTRUMENTATION_NAME = "task-orchestrator";

  @Singleton
  public PrometheusMeterRegistry prometheusMeterRegistry() {
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  @Singleton
  public MetricsCollector metricsCollector(PrometheusMeterRegistry registry) {
    return new MetricsCollector(registry);
  }

  @Singleton
  public ActivityLogger activityLogger(
      ObservabilityConfig observability,
      LogRepository logRepository,
      EventRepository eventRepository) {
    return new ActivityLogger(observability.getPersistedLevel(), logRepository, eventRepository);
  }

  /** Activities get a tracing stage only when observability.tracing-enabled is set. */
  @Singleton
  public ActivityRegistry activityRegistry(
      ActivitiesConfig activities,
      ObservabilityConfig observability,
      ActivityLogger activityLogger,
      MetricsCollector metrics) {
    Tracer tracer = null;
    if (observability.isTracingEnabled()) {
      tracer = GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME);
    }
    return new ActivityRegistry(activities, activityLogger, metrics, tracer);
  }

  @Singleton
  public OtlpReceiver otlpReceiver(EventRepository eventRepository) {
    return new OtlpReceiver(eventRepository);
  }

  /** Started eagerly so pushed telemetry is accepted as soon as the worker is up. */
  @Context
  @Requires(property = "observability.otlp-enabled", notEquals = "false")
  public OtlpReceiverServer otlpReceiverServer(
      OtlpReceiver receiver, ObservabilityConfig observability) {
    return OtlpReceiverServer.forAddress(
            receiver, observability.getOtlpHost(), observability.getOtlpPort())
        .start();
  }
}
