package com.acme.orchestrator.otlp;

import com.acme.orchestrator.telemetry.TelemetryEvent;
import com.google.protobuf.ByteString;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.metrics.v1.HistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.trace.v1.Span;
import io.opentelemetry.proto.trace.v1.Status;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Converts OTLP logs, metric data points and spans into {@link TelemetryEvent}s. Timestamps are
 * truncated to milliseconds.
 */
public class OtlpEventConverter {

  static final String UNKNOWN_TRACE_ID = "unknown";
  static final String TRACE_ID_ATTRIBUTE = "trace_id";
  static final String HISTOGRAM_COUNT_SUFFIX = "_count";
  static final String STATUS_OK = "OK";

  private static final HexFormat HEX = HexFormat.of();
  private static final int TRACE_ID_HEX_LENGTH = 32;
  private static final int SPAN_ID_HEX_LENGTH = 16;

  private final Clock clock;

  public OtlpEventConverter() {
    this(Clock.systemUTC());
  }

  public OtlpEventConverter(Clock clock) {
    this.clock = clock;
  }

  /** Log record with an unset time is stamped with the current time. */
  public TelemetryEvent toEvent(LogRecord log) {
    return TelemetryEvent.log(
        hex(log.getTraceId(), TRACE_ID_HEX_LENGTH),
        hex(log.getSpanId(), SPAN_ID_HEX_LENGTH),
        timestampOrNow(log.getTimeUnixNano()),
        log.getBody().getStringValue(),
        log.getSeverityText(),
        AttributeValues.toMap(log.getAttributesList()));
  }

  /**
   * One event per data point. Sums and gauges keep their value; histograms report their count
   * under {@code <name>_count}. Other metric kinds produce no events.
   */
  public List<TelemetryEvent> toEvents(Metric metric) {
    List<TelemetryEvent> events = new ArrayList<>();
    switch (metric.getDataCase()) {
      case SUM -> metric.getSum().getDataPointsList().forEach(dp -> events.add(number(metric, dp)));
      case GAUGE ->
          metric.getGauge().getDataPointsList().forEach(dp -> events.add(number(metric, dp)));
      case HISTOGRAM ->
          metric.getHistogram().getDataPointsList().forEach(dp -> events.add(count(metric, dp)));
      default -> {
        // exponential histograms and summaries are not stored
      }
    }
    return events;
  }

  /**
   * Span latency is end minus start in milliseconds. The status is its message, else the
   * symbolic code name, or {@code OK} when the span carries no status.
   */
  public TelemetryEvent toEvent(Span span) {
    Instant end = fromNanos(span.getEndTimeUnixNano());
    Instant start = fromNanos(span.getStartTimeUnixNano());
    return TelemetryEvent.trace(
        hex(span.getTraceId(), TRACE_ID_HEX_LENGTH),
        hex(span.getSpanId(), SPAN_ID_HEX_LENGTH),
        span.getName(),
        end,
        end.toEpochMilli() - start.toEpochMilli(),
        statusOf(span),
        AttributeValues.toMap(span.getAttributesList()));
  }

  static String statusOf(Span span) {
    if (!span.hasStatus()) {
      return STATUS_OK;
    }
    Status status = span.getStatus();
    if (!status.getMessage().isEmpty()) {
      return status.getMessage();
    }
    return status.getCode().name();
  }

  /** Lowercase hex, left-padded with zeros to {@code width} characters. */
  static String hex(ByteString bytes, int width) {
    String hex = HEX.formatHex(bytes.toByteArray());
    if (hex.length() >= width) {
      return hex;
    }
    return "0".repeat(width - hex.length()) + hex;
  }

  private TelemetryEvent number(Metric metric, NumberDataPoint dp) {
    double value =
        switch (dp.getValueCase()) {
          case AS_INT -> dp.getAsInt();
          case AS_DOUBLE -> dp.getAsDouble();
          case VALUE_NOT_SET -> 0.0;
        };
    return metricEvent(
        metric.getName(), metric.getUnit(), value, dp.getTimeUnixNano(), dp.getAttributesList());
  }

  private TelemetryEvent count(Metric metric, HistogramDataPoint dp) {
    return metricEvent(
        metric.getName() + HISTOGRAM_COUNT_SUFFIX,
        metric.getUnit(),
        dp.getCount(),
        dp.getTimeUnixNano(),
        dp.getAttributesList());
  }

  private TelemetryEvent metricEvent(
      String name, String unit, double value, long timeUnixNano, List<KeyValue> attributes) {
    return TelemetryEvent.metric(
        AttributeValues.stringValue(attributes, TRACE_ID_ATTRIBUTE, UNKNOWN_TRACE_ID),
        timestampOrNow(timeUnixNano),
        name,
        value,
        unit,
        AttributeValues.toMap(attributes));
  }

  private Instant timestampOrNow(long unixNanos) {
    return unixNanos > 0 ? fromNanos(unixNanos) : clock.instant();
  }

  private static Instant fromNanos(long unixNanos) {
    return Instant.ofEpochMilli(unixNanos / 1_000_000);
  }
}
