package com.acme.orchestrator.otlp;

import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.telemetry.TelemetryEvent;
import io.grpc.BindableService;
import io.grpc.stub.StreamObserver;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.collector.logs.v1.LogsServiceGrpc;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import io.opentelemetry.proto.collector.metrics.v1.MetricsServiceGrpc;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceResponse;
import io.opentelemetry.proto.collector.trace.v1.TraceServiceGrpc;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;
import io.opentelemetry.proto.trace.v1.Span;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OTLP collector endpoint that stores every received log record, metric data point and span as a
 * task event. A record that fails to convert or to be written is logged and dropped; the export
 * call itself always succeeds.
 */
public class OtlpReceiver {

  private static final Logger LOG = LoggerFactory.getLogger(OtlpReceiver.class);

  private final EventRepository eventRepository;
  private final OtlpEventConverter converter;
  private final AtomicLong accepted = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  public OtlpReceiver(EventRepository eventRepository) {
    this(eventRepository, new OtlpEventConverter());
  }

  public OtlpReceiver(EventRepository eventRepository, OtlpEventConverter converter) {
    this.eventRepository = eventRepository;
    this.converter = converter;
  }

  public List<BindableService> services() {
    return List.of(new LogsService(), new MetricsService(), new TraceService());
  }

  public long acceptedCount() {
    return accepted.get();
  }

  public long droppedCount() {
    return dropped.get();
  }

  void exportLogs(ExportLogsServiceRequest request) {
    for (ResourceLogs resourceLogs : request.getResourceLogsList()) {
      for (ScopeLogs scopeLogs : resourceLogs.getScopeLogsList()) {
        for (LogRecord log : scopeLogs.getLogRecordsList()) {
          try {
            store(converter.toEvent(log));
          } catch (RuntimeException e) {
            drop("log", e);
          }
        }
      }
    }
  }

  void exportMetrics(ExportMetricsServiceRequest request) {
    for (ResourceMetrics resourceMetrics : request.getResourceMetricsList()) {
      for (ScopeMetrics scopeMetrics : resourceMetrics.getScopeMetricsList()) {
        for (Metric metric : scopeMetrics.getMetricsList()) {
          List<TelemetryEvent> events;
          try {
            events = converter.toEvents(metric);
          } catch (RuntimeException e) {
            drop("metric", e);
            continue;
          }
          for (TelemetryEvent event : events) {
            try {
              store(event);
            } catch (RuntimeException e) {
              drop("metric", e);
            }
          }
        }
      }
    }
  }

  void exportSpans(ExportTraceServiceRequest request) {
    for (ResourceSpans resourceSpans : request.getResourceSpansList()) {
      for (ScopeSpans scopeSpans : resourceSpans.getScopeSpansList()) {
        for (Span span : scopeSpans.getSpansList()) {
          try {
            store(converter.toEvent(span));
          } catch (RuntimeException e) {
            drop("trace", e);
          }
        }
      }
    }
  }

  private void store(TelemetryEvent event) {
    eventRepository.write(event);
    accepted.incrementAndGet();
  }

  private void drop(String kind, RuntimeException e) {
    dropped.incrementAndGet();
    LOG.error("Failed to write {} event", kind, e);
  }

  private class LogsService extends LogsServiceGrpc.LogsServiceImplBase {
    @Override
    public void export(
        ExportLogsServiceRequest request,
        StreamObserver<ExportLogsServiceResponse> responseObserver) {
      exportLogs(request);
      responseObserver.onNext(ExportLogsServiceResponse.getDefaultInstance());
      responseObserver.onCompleted();
    }
  }

  private class MetricsService extends MetricsServiceGrpc.MetricsServiceImplBase {
    @Override
    public void export(
        ExportMetricsServiceRequest request,
        StreamObserver<ExportMetricsServiceResponse> responseObserver) {
      exportMetrics(request);
      responseObserver.onNext(ExportMetricsServiceResponse.getDefaultInstance());
      responseObserver.onCompleted();
    }
  }

  private class TraceService extends TraceServiceGrpc.TraceServiceImplBase {
    @Override
    public void export(
        ExportTraceServiceRequest request,
        StreamObserver<ExportTraceServiceResponse> responseObserver) {
      exportSpans(request);
      responseObserver.onNext(ExportTraceServiceResponse.getDefaultInstance());
      responseObserver.onCompleted();
    }
  }
}
