package com.acme.orchestrator.repository;

import com.acme.orchestrator.telemetry.EventType;
import com.acme.orchestrator.telemetry.TelemetryEvent;
import java.time.Duration;
import java.util.List;

/** Buffered store for {@link TelemetryEvent}s. Same batching contract as {@link LogRepository}. */
public interface EventRepository extends AutoCloseable {

  void write(TelemetryEvent event);

  void flush();

  int pendingCount();

  List<TelemetryEvent> findByTraceId(String traceId);

  List<TelemetryEvent> findByOrchestrationId(String orchestrationId);

  /** Up to 1000 events of the given type, newest first. */
  List<TelemetryEvent> findByEventType(EventType eventType);

  /**
   * Latency statistics of trace events per activity in the trailing {@code window}, for activities
   * whose slowest span exceeded {@code thresholdMs}.
   */
  List<ActivityStats> findActivityPerformance(long thresholdMs, Duration window);

  /** Events carrying an error or an {@code ERROR} span status, newest first. */
  List<TelemetryEvent> findErrorEvents(int limit);

  int pruneOlderThan(Duration age);

  @Override
  void close();
}
