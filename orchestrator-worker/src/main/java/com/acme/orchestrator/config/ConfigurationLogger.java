package com.acme.orchestrator.config;

import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs the effective worker configuration once the HTTP server is up. */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);
  private static final String RULE =
      "===============================================================================";

  private final ActivitiesConfig activities;
  private final ObservabilityConfig observability;
  private final StorageConfig storage;

  @Property(name = "micronaut.server.port")
  private int serverPort;

  public ConfigurationLogger(
      ActivitiesConfig activities, ObservabilityConfig observability, StorageConfig storage) {
    this.activities = activities;
    this.observability = observability;
    this.storage = storage;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    LOG.info(RULE);
    LOG.info("                     TASK ORCHESTRATOR WORKER CONFIGURATION");
    LOG.info(RULE);

    LOG.info("--- Activities ---");
    LOG.info("  Timeout:            {}", activities.getTimeout());
    LOG.info(
        "  Retry:              {} attempts, backoff {} x{} up to {}",
        activities.getRetryMaxAttempts(),
        activities.getRetryInitialBackoff(),
        activities.getRetryBackoffMultiplier(),
        activities.getRetryMaxBackoff());
    if (activities.isCircuitBreakerEnabled()) {
      LOG.info(
          "  Circuit Breaker:    threshold {}, min requests {}, open for {}",
          activities.getCircuitBreakerThreshold(),
          activities.getCircuitBreakerMinRequests(),
          activities.getCircuitBreakerTimeout());
    } else {
      LOG.info("  Circuit Breaker:    DISABLED");
    }

    LOG.info("--- Observability ---");
    LOG.info("  Persisted Level:    {}", observability.getPersistedLevel().value());
    LOG.info("  Tracing:            {}", observability.isTracingEnabled() ? "ENABLED" : "DISABLED");
    if (observability.isOtlpEnabled()) {
      LOG.info(
          "  OTLP Receiver:      {}:{}", observability.getOtlpHost(), observability.getOtlpPort());
    } else {
      LOG.info("  OTLP Receiver:      DISABLED");
    }
    LOG.info("  HTTP Port:          {} (/health, /metrics)", serverPort);

    LOG.info("--- Storage ---");
    LOG.info("  Dialect:            {}", storage.getDialect());
    LOG.info("  JDBC URL:           {}", storage.resolveJdbcUrl());
    LOG.info("  Max Pool Size:      {}", storage.getMaxPoolSize());
    LOG.info(
        "  Batching:           {} records or every {}",
        storage.getBatchSize(),
        storage.getFlushInterval());
    LOG.info("  Retention:          {}", storage.getRetention());
    LOG.info(RULE);
  }
}
