package com.acme.orchestrator.telemetry;

import com.acme.orchestrator.core.Jsons;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Row of the {@code task_events} table: a log line, metric data point or span, with its JSON
 * payload already serialized.
 */
public record TelemetryEvent(
    Long id,
    Instant timestamp,
    String traceId,
    String spanId,
    String orchestrationId,
    EventType eventType,
    String activity,
    String payload) {

  public static final String ORCHESTRATION_ID_ATTRIBUTE = "orchestration_id";
  public static final String ACTIVITY_ATTRIBUTE = "activity";

  public TelemetryEvent {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(payload, "payload");
  }

  public static TelemetryEvent log(
      String traceId,
      String spanId,
      Instant timestamp,
      String message,
      String severity,
      Map<String, Object> attributes) {
    return of(
        EventType.LOG, traceId, spanId, timestamp, EventPayload.log(message, severity, attributes));
  }

  /** Metric events carry no span and are not linked to an orchestration or activity. */
  public static TelemetryEvent metric(
      String traceId,
      Instant timestamp,
      String name,
      double value,
      String unit,
      Map<String, Object> attributes) {
    return new TelemetryEvent(
        null,
        timestamp,
        traceId,
        null,
        null,
        EventType.METRIC,
        null,
        Jsons.toJson(EventPayload.metric(name, value, unit, attributes)));
  }

  public static TelemetryEvent trace(
      String traceId,
      String spanId,
      String spanName,
      Instant timestamp,
      long latencyMs,
      String status,
      Map<String, Object> attributes) {
    return of(
        EventType.TRACE,
        traceId,
        spanId,
        timestamp,
        EventPayload.span(spanName, latencyMs, status, attributes));
  }

  /**
   * Builds an event from a payload, lifting the {@code orchestration_id} and {@code activity}
   * attributes into their own columns when they are strings.
   */
  public static TelemetryEvent of(
      EventType type, String traceId, String spanId, Instant timestamp, EventPayload payload) {
    Map<String, Object> attributes = payload.attributes();
    return new TelemetryEvent(
        null,
        timestamp,
        traceId,
        spanId,
        stringAttribute(attributes, ORCHESTRATION_ID_ATTRIBUTE),
        type,
        stringAttribute(attributes, ACTIVITY_ATTRIBUTE),
        Jsons.toJson(payload));
  }

  public EventPayload payloadObject() {
    return Jsons.fromJson(payload, EventPayload.class);
  }

  private static String stringAttribute(Map<String, Object> attributes, String key) {
    if (attributes == null) {
      return null;
    }
    return attributes.get(key) instanceof String s ? s : null;
  }
}
