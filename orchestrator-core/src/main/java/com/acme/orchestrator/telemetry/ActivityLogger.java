package com.acme.orchestrator.telemetry;

import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.repository.LogRepository;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console and persistent logging for activity executions. Every record is written to SLF4J; records
 * at or above the configured level are also persisted. Storage failures are logged and never
 * propagated to the caller.
 */
public class ActivityLogger {
  private static final Logger LOG = LoggerFactory.getLogger(ActivityLogger.class);

  private final LogLevel persistedLevel;
  private final LogRepository logRepository;
  private final EventRepository eventRepository;

  public ActivityLogger(
      LogLevel persistedLevel, LogRepository logRepository, EventRepository eventRepository) {
    this.persistedLevel = Objects.requireNonNull(persistedLevel, "persistedLevel");
    this.logRepository = Objects.requireNonNull(logRepository, "logRepository");
    this.eventRepository = Objects.requireNonNull(eventRepository, "eventRepository");
  }

  public LogLevel getPersistedLevel() {
    return persistedLevel;
  }

  /** Writes the record to the console and, if its level qualifies, to the log store. */
  public void log(LogRecord record) {
    console(record);
    if (!record.level().isAtLeast(persistedLevel)) {
      return;
    }
    try {
      logRepository.write(record);
    } catch (RuntimeException e) {
      LOG.warn(
          "Failed to persist log record activity={} traceId={}",
          record.activity(),
          record.traceId(),
          e);
    }
  }

  /** Stores a telemetry event. */
  public void emit(TelemetryEvent event) {
    try {
      eventRepository.write(event);
    } catch (RuntimeException e) {
      LOG.warn(
          "Failed to persist {} event activity={} traceId={}",
          event.eventType().value(),
          event.activity(),
          event.traceId(),
          e);
    }
  }

  private static void console(LogRecord record) {
    switch (record.level()) {
      case DEBUG -> LOG.debug("{} durationMs={}", record.message(), record.durationMs());
      case INFO -> LOG.info("{} durationMs={}", record.message(), record.durationMs());
      case WARN ->
          LOG.warn(
              "{} durationMs={} error={}",
              record.message(),
              record.durationMs(),
              record.errorMessage());
      case ERROR ->
          LOG.error(
              "{} durationMs={} error={} errorHash={}",
              record.message(),
              record.durationMs(),
              record.errorMessage(),
              record.errorHash());
    }
  }
}
