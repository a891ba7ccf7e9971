package com.acme.orchestrator.telemetry;

import java.util.Map;

/**
 * JSON body of a {@link TelemetryEvent}. Which fields are set depends on the event type. Serialized
 * through {@link com.acme.orchestrator.core.Jsons}, so names are snake_case and nulls are dropped.
 */
public record EventPayload(
    String msg,
    String severity,
    String error,
    String metricName,
    Double metricValue,
    String metricUnit,
    String spanName,
    String spanKind,
    String spanStatus,
    Long latencyMs,
    Map<String, Object> attributes) {

  public static EventPayload log(String message, String severity, Map<String, Object> attributes) {
    return new EventPayload(
        message, severity, null, null, null, null, null, null, null, null, attributes);
  }

  public static EventPayload metric(
      String name, double value, String unit, Map<String, Object> attributes) {
    return new EventPayload(
        null, null, null, name, value, unit, null, null, null, null, attributes);
  }

  public static EventPayload span(
      String spanName, long latencyMs, String spanStatus, Map<String, Object> attributes) {
    return new EventPayload(
        null, null, null, null, null, null, spanName, null, spanStatus, latencyMs, attributes);
  }

  public EventPayload withError(String error) {
    return new EventPayload(
        msg, severity, error, metricName, metricValue, metricUnit, spanName, spanKind, spanStatus,
        latencyMs, attributes);
  }

  public EventPayload withSpanKind(String spanKind) {
    return new EventPayload(
        msg, severity, error, metricName, metricValue, metricUnit, spanName, spanKind, spanStatus,
        latencyMs, attributes);
  }
}
