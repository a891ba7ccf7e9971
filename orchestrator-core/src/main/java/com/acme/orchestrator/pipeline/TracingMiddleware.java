package com.acme.orchestrator.pipeline;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Objects;

/** Opens one OpenTelemetry span per activity invocation. */
public class TracingMiddleware implements ActivityMiddleware {

  static final AttributeKey<String> ACTIVITY = AttributeKey.stringKey("activity");
  static final AttributeKey<String> ORCHESTRATION_ID = AttributeKey.stringKey("orchestration_id");
  static final AttributeKey<String> TRACE_ID = AttributeKey.stringKey("trace_id");

  private final Tracer tracer;
  private final String activityName;

  public TracingMiddleware(Tracer tracer, String activityName) {
    this.tracer = Objects.requireNonNull(tracer, "tracer");
    this.activityName = Objects.requireNonNull(activityName, "activityName");
  }

  @Override
  public ActivityFunction wrap(ActivityFunction next) {
    return (context, input) -> {
      Span span =
          tracer
              .spanBuilder("activity:" + activityName)
              .setSpanKind(SpanKind.INTERNAL)
              .setAttribute(ACTIVITY, activityName)
              .setAttribute(TRACE_ID, context.getTraceId())
              .startSpan();
      if (context.getOrchestrationId() != null) {
        span.setAttribute(ORCHESTRATION_ID, context.getOrchestrationId());
      }
      try (Scope ignored = span.makeCurrent()) {
        return next.execute(context, input);
      } catch (RuntimeException e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : "");
        throw e;
      } finally {
        span.end();
      }
    };
  }
}
