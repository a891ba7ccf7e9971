package com.acme.orchestrator.lifecycle;

import com.acme.orchestrator.otlp.OtlpReceiverServer;
import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.repository.LogRepository;
import io.micronaut.context.annotation.Context;
import io.micronaut.core.annotation.Nullable;
import jakarta.annotation.PreDestroy;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shuts the telemetry path down front to back: the OTLP receiver stops accepting data, then each
 * repository flushes its last batch, then the connection pool closes. A failing step is logged and
 * the remaining steps still run.
 */
@Context
public class TelemetryLifecycle {

  private static final Logger LOG = LoggerFactory.getLogger(TelemetryLifecycle.class);

  private final OtlpReceiverServer receiverServer;
  private final EventRepository eventRepository;
  private final LogRepository logRepository;
  private final DataSource dataSource;

  public TelemetryLifecycle(
      @Nullable OtlpReceiverServer receiverServer,
      EventRepository eventRepository,
      LogRepository logRepository,
      DataSource dataSource) {
    this.receiverServer = receiverServer;
    this.eventRepository = eventRepository;
    this.logRepository = logRepository;
    this.dataSource = dataSource;
  }

  @PreDestroy
  public void shutdown() {
    LOG.info("Shutting down telemetry");
    if (receiverServer != null) {
      closeQuietly("OTLP receiver", receiverServer);
    }
    closeQuietly("event repository", eventRepository);
    closeQuietly("log repository", logRepository);
    if (dataSource instanceof AutoCloseable closeable) {
      closeQuietly("data source", closeable);
    }
    LOG.info("Telemetry shut down");
  }

  private static void closeQuietly(String name, AutoCloseable resource) {
    try {
      resource.close();
    } catch (Exception e) {
      LOG.error("Failed to close {}", name, e);
    }
  }
}
