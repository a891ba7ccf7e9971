package com.acme.orchestrator.pipeline;

import com.acme.orchestrator.core.TraceIds;
import com.acme.orchestrator.telemetry.ActivityLogger;
import com.acme.orchestrator.telemetry.EventPayload;
import com.acme.orchestrator.telemetry.EventType;
import com.acme.orchestrator.telemetry.LogLevel;
import com.acme.orchestrator.telemetry.LogRecord;
import com.acme.orchestrator.telemetry.MetricsCollector;
import com.acme.orchestrator.telemetry.TelemetryEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.MDC;

/**
 * Records every invocation: a start record, an outcome record with duration, payload fingerprints
 * and error details, a trace event for the activity span, and execution metrics. The MDC carries
 * the trace id, activity and orchestration id while the invocation runs.
 */
public class LoggingMiddleware implements ActivityMiddleware {

  static final String MDC_TRACE_ID = "traceId";
  static final String MDC_ACTIVITY = "activity";
  static final String MDC_ORCHESTRATION_ID = "orchestrationId";

  private final ActivityLogger logger;
  private final MetricsCollector metrics;
  private final String activityName;

  /**
   * @param metrics may be null, in which case no metrics are recorded
   */
  public LoggingMiddleware(ActivityLogger logger, MetricsCollector metrics, String activityName) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.metrics = metrics;
    this.activityName = Objects.requireNonNull(activityName, "activityName");
  }

  @Override
  public ActivityFunction wrap(ActivityFunction next) {
    return (context, input) -> {
      String spanId = TraceIds.generateSpanId();
      MDC.put(MDC_TRACE_ID, context.getTraceId());
      MDC.put(MDC_ACTIVITY, activityName);
      if (context.getOrchestrationId() != null) {
        MDC.put(MDC_ORCHESTRATION_ID, context.getOrchestrationId());
      }
      Instant startedAt = Instant.now();
      long start = System.nanoTime();
      try {
        logger.log(record(context, spanId, LogLevel.INFO, "activity started").withInput(input));
        byte[] output;
        try {
          output = next.execute(context, input);
        } catch (RuntimeException e) {
          Duration duration = Duration.ofNanos(System.nanoTime() - start);
          String error = errorText(e);
          logger.log(
              record(context, spanId, LogLevel.ERROR, "activity failed")
                  .withDuration(duration)
                  .withInput(input)
                  .withError(error));
          logger.emit(span(context, spanId, startedAt, duration, "ERROR", error));
          recordMetrics(duration, true);
          throw e;
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        logger.log(
            record(context, spanId, LogLevel.INFO, "activity completed")
                .withDuration(duration)
                .withInput(input)
                .withOutput(output));
        logger.emit(span(context, spanId, startedAt, duration, "OK", null));
        recordMetrics(duration, false);
        return output;
      } finally {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_ACTIVITY);
        MDC.remove(MDC_ORCHESTRATION_ID);
      }
    };
  }

  private LogRecord record(ActivityContext context, String spanId, LogLevel level, String message) {
    return LogRecord.of(level, context.getTraceId(), message)
        .withSpanId(spanId)
        .withActivity(activityName)
        .withOrchestrationId(context.getOrchestrationId());
  }

  private TelemetryEvent span(
      ActivityContext context,
      String spanId,
      Instant startedAt,
      Duration duration,
      String status,
      String error) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put(TelemetryEvent.ACTIVITY_ATTRIBUTE, activityName);
    if (context.getOrchestrationId() != null) {
      attributes.put(TelemetryEvent.ORCHESTRATION_ID_ATTRIBUTE, context.getOrchestrationId());
    }
    EventPayload payload =
        EventPayload.span(activityName, duration.toMillis(), status, attributes)
            .withSpanKind("internal")
            .withError(error);
    return TelemetryEvent.of(EventType.TRACE, context.getTraceId(), spanId, startedAt, payload);
  }

  private void recordMetrics(Duration duration, boolean failed) {
    if (metrics != null) {
      metrics.recordActivityExecution(duration, failed);
    }
  }

  private static String errorText(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
  }
}
