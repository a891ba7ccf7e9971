package com.acme.orchestrator.lifecycle;

import com.acme.orchestrator.config.StorageConfig;
import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.repository.LogRepository;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Periodically deletes telemetry older than storage.retention from both tables. */
@Singleton
public class RetentionSweeper {
  private static final Logger LOG = LoggerFactory.getLogger(RetentionSweeper.class);

  private final LogRepository logRepository;
  private final EventRepository eventRepository;
  private final Duration retention;

  public RetentionSweeper(
      LogRepository logRepository, EventRepository eventRepository, StorageConfig storage) {
    this.logRepository = logRepository;
    this.eventRepository = eventRepository;
    this.retention = storage.getRetention();
  }

  @Scheduled(
      fixedDelay = "${storage.retention-sweep-interval:1h}",
      initialDelay = "${storage.retention-sweep-initial-delay:1m}")
  public void sweep() {
    try {
      int logs = logRepository.pruneOlderThan(retention);
      int events = eventRepository.pruneOlderThan(retention);
      if (logs > 0 || events > 0) {
        LOG.info("Retention sweep removed {} log records and {} task events", logs, events);
      }
    } catch (Exception e) {
      LOG.error("Error in RetentionSweeper sweep: {}", e.getMessage(), e);
    }
  }
}
