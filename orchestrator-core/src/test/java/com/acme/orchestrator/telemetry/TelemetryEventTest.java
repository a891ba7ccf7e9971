package com.acme.orchestrator.telemetry;

import static org.assertj.core.api.Assertions.*;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TelemetryEventTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

  @Test
  @DisplayName("log events should lift orchestration and activity attributes into columns")
  void testLogEvent() {
    TelemetryEvent event =
        TelemetryEvent.log(
            "trace-1",
            "span-1",
            NOW,
            "reserved",
            "INFO",
            Map.of("orchestration_id", "orch-1", "activity", "inventory:reserve", "qty", 2));

    assertThat(event.eventType()).isEqualTo(EventType.LOG);
    assertThat(event.orchestrationId()).isEqualTo("orch-1");
    assertThat(event.activity()).isEqualTo("inventory:reserve");
    assertThat(event.payload()).contains("\"msg\":\"reserved\"").contains("\"severity\":\"INFO\"");
    assertThat(event.payloadObject().attributes()).containsEntry("qty", 2);
  }

  @Test
  @DisplayName("Non-string attributes should not be lifted")
  void testNonStringAttributes() {
    TelemetryEvent event =
        TelemetryEvent.log("t", null, NOW, "m", "INFO", Map.of("orchestration_id", 42));

    assertThat(event.orchestrationId()).isNull();
    assertThat(event.activity()).isNull();
  }

  @Test
  @DisplayName("trace events should carry span name, latency and status")
  void testTraceEvent() {
    TelemetryEvent event =
        TelemetryEvent.trace(
            "trace-1", "span-1", "charge", NOW, 1450, "OK", Map.of("activity", "payment:charge"));

    EventPayload payload = event.payloadObject();
    assertThat(event.eventType()).isEqualTo(EventType.TRACE);
    assertThat(event.activity()).isEqualTo("payment:charge");
    assertThat(payload.spanName()).isEqualTo("charge");
    assertThat(payload.latencyMs()).isEqualTo(1450L);
    assertThat(payload.spanStatus()).isEqualTo("OK");
  }

  @Test
  @DisplayName("metric events should not be linked to an orchestration")
  void testMetricEvent() {
    TelemetryEvent event =
        TelemetryEvent.metric(
            "unknown", NOW, "orders_total", 3.0, "1", Map.of("orchestration_id", "orch-1"));

    assertThat(event.eventType()).isEqualTo(EventType.METRIC);
    assertThat(event.spanId()).isNull();
    assertThat(event.orchestrationId()).isNull();
    assertThat(event.payloadObject().metricName()).isEqualTo("orders_total");
    assertThat(event.payloadObject().metricValue()).isEqualTo(3.0);
  }

  @Test
  @DisplayName("EventType should map to lowercase names")
  void testEventTypeValues() {
    assertThat(EventType.fromValue("trace")).isEqualTo(EventType.TRACE);
    assertThatThrownBy(() -> EventType.fromValue("span"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
