package com.acme.orchestrator.pipeline;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.acme.orchestrator.breaker.CircuitBreaker;
import com.acme.orchestrator.core.ClassifiedException;
import com.acme.orchestrator.core.ErrorKind;
import com.acme.orchestrator.core.Hashes;
import com.acme.orchestrator.core.TransientException;
import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.repository.LogRepository;
import com.acme.orchestrator.telemetry.ActivityLogger;
import com.acme.orchestrator.telemetry.EventPayload;
import com.acme.orchestrator.telemetry.EventType;
import com.acme.orchestrator.telemetry.LogLevel;
import com.acme.orchestrator.telemetry.LogRecord;
import com.acme.orchestrator.telemetry.MetricsCollector;
import com.acme.orchestrator.telemetry.TelemetryEvent;
import io.grpc.Status;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ActivityPipelineTest {

  private static final RetryPolicy FAST =
      new RetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(20), 2.0);
  private static final byte[] INPUT = "{\"orderId\":\"o-1\"}".getBytes(StandardCharsets.UTF_8);
  private static final byte[] OUTPUT = "{\"status\":\"charged\"}".getBytes(StandardCharsets.UTF_8);

  @Nested
  @DisplayName("apply")
  class Apply {

    @Test
    @DisplayName("First middleware should be the outermost")
    void testOrder() {
      List<String> calls = new ArrayList<>();
      ActivityMiddleware a = tracking("a", calls);
      ActivityMiddleware b = tracking("b", calls);

      ActivityPipeline.apply(
              (ctx, in) -> {
                calls.add("fn");
                return in;
              },
              a,
              b)
          .execute(ActivityContext.create("x"), new byte[0]);

      assertThat(calls).containsExactly("a-in", "b-in", "fn", "b-out", "a-out");
    }

    @Test
    @DisplayName("No middleware should return the function itself")
    void testEmpty() {
      ActivityFunction fn = (ctx, in) -> in;

      assertThat(ActivityPipeline.apply(fn)).isSameAs(fn);
    }

    private ActivityMiddleware tracking(String name, List<String> calls) {
      return next ->
          (ctx, in) -> {
            calls.add(name + "-in");
            byte[] out = next.execute(ctx, in);
            calls.add(name + "-out");
            return out;
          };
    }
  }

  @Nested
  @DisplayName("Standard chain")
  class StandardChain {

    private LogRepository logRepository;
    private EventRepository eventRepository;
    private SimpleMeterRegistry meterRegistry;
    private ActivityPipeline.Builder builder;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
      logRepository = mock(LogRepository.class);
      eventRepository = mock(EventRepository.class);
      meterRegistry = new SimpleMeterRegistry();
      ActivityLogger activityLogger =
          new ActivityLogger(LogLevel.INFO, logRepository, eventRepository);
      builder =
          ActivityPipeline.builder("payment:charge")
              .logging(activityLogger, new MetricsCollector(meterRegistry))
              .timeout(Duration.ofSeconds(5))
              .retry(FAST);
      invocations = new AtomicInteger();
    }

    @Test
    @DisplayName("RESOURCE_EXHAUSTED should be retried until attempts run out")
    void testTransientGrpcErrorRetried() {
      ActivityFunction fn =
          builder.build(
              (ctx, in) -> {
                invocations.incrementAndGet();
                throw Status.RESOURCE_EXHAUSTED.withDescription("quota").asRuntimeException();
              });

      assertThatThrownBy(() -> fn.execute(ActivityContext.create("payment:charge"), INPUT))
          .isInstanceOfSatisfying(
              ClassifiedException.class,
              e -> {
                assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSIENT);
                assertThat(e.getCode()).isEqualTo("GRPC_RESOURCE_EXHAUSTED");
              });
      assertThat(invocations).hasValue(3);
    }

    @Test
    @DisplayName("INVALID_ARGUMENT should not be retried")
    void testPermanentGrpcErrorNotRetried() {
      ActivityFunction fn =
          builder.build(
              (ctx, in) -> {
                invocations.incrementAndGet();
                throw Status.INVALID_ARGUMENT.withDescription("bad card").asRuntimeException();
              });

      assertThatThrownBy(() -> fn.execute(ActivityContext.create("payment:charge"), INPUT))
          .isInstanceOfSatisfying(
              ClassifiedException.class,
              e -> assertThat(e.getCode()).isEqualTo("GRPC_INVALID_ARGUMENT"));
      assertThat(invocations).hasValue(1);
    }

    @Test
    @DisplayName("Success should persist start and completion records and a trace event")
    void testSuccessTelemetry() {
      ActivityFunction fn =
          builder.build(
              (ctx, in) -> {
                if (invocations.incrementAndGet() == 1) {
                  throw Status.UNAVAILABLE.asRuntimeException();
                }
                return OUTPUT;
              });

      byte[] output =
          fn.execute(ActivityContext.create("payment:charge", "trace-1", "orch-1"), INPUT);

      assertThat(output).isEqualTo(OUTPUT);
      ArgumentCaptor<LogRecord> records = ArgumentCaptor.forClass(LogRecord.class);
      verify(logRepository, times(2)).write(records.capture());
      LogRecord started = records.getAllValues().get(0);
      LogRecord completed = records.getAllValues().get(1);
      assertThat(started.message()).isEqualTo("activity started");
      assertThat(completed.message()).isEqualTo("activity completed");
      assertThat(completed.traceId()).isEqualTo("trace-1");
      assertThat(completed.orchestrationId()).isEqualTo("orch-1");
      assertThat(completed.activity()).isEqualTo("payment:charge");
      assertThat(completed.inputHash()).isEqualTo(Hashes.hashData(INPUT));
      assertThat(completed.outputHash()).isEqualTo(Hashes.hashData(OUTPUT));
      assertThat(completed.errorMessage()).isNull();

      ArgumentCaptor<TelemetryEvent> events = ArgumentCaptor.forClass(TelemetryEvent.class);
      verify(eventRepository).write(events.capture());
      TelemetryEvent trace = events.getValue();
      assertThat(trace.eventType()).isEqualTo(EventType.TRACE);
      assertThat(trace.activity()).isEqualTo("payment:charge");
      assertThat(trace.orchestrationId()).isEqualTo("orch-1");
      EventPayload payload = trace.payloadObject();
      assertThat(payload.spanStatus()).isEqualTo("OK");
      assertThat(payload.error()).isNull();

      assertThat(meterRegistry.get("activity.executions").counter().count()).isEqualTo(1.0);
      assertThat(meterRegistry.get("activity.errors").counter().count()).isZero();
    }

    @Test
    @DisplayName("Failure should persist the error text and grouping hash")
    void testFailureTelemetry() {
      ActivityFunction fn =
          builder.build(
              (ctx, in) -> {
                throw Status.NOT_FOUND.withDescription("no such order").asRuntimeException();
              });

      assertThatThrownBy(() -> fn.execute(ActivityContext.create("payment:charge"), INPUT))
          .isInstanceOf(ClassifiedException.class);

      ArgumentCaptor<LogRecord> records = ArgumentCaptor.forClass(LogRecord.class);
      verify(logRepository, times(2)).write(records.capture());
      LogRecord failed = records.getAllValues().get(1);
      assertThat(failed.level()).isEqualTo(LogLevel.ERROR);
      assertThat(failed.errorMessage())
          .isEqualTo("GRPC_NOT_FOUND: gRPC error (permanent): no such order");
      assertThat(failed.errorHash()).isEqualTo(Hashes.hashError("GRPC_NOT_FOUND"));

      ArgumentCaptor<TelemetryEvent> events = ArgumentCaptor.forClass(TelemetryEvent.class);
      verify(eventRepository).write(events.capture());
      assertThat(events.getValue().payloadObject().spanStatus()).isEqualTo("ERROR");
      assertThat(events.getValue().payloadObject().error()).startsWith("GRPC_NOT_FOUND");
      assertThat(meterRegistry.get("activity.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Storage failures should not fail the activity")
    void testStorageFailureIgnored() {
      doThrow(new IllegalStateException("repository closed")).when(logRepository).write(any());
      doThrow(new IllegalStateException("repository closed")).when(eventRepository).write(any());

      byte[] output =
          builder.build((ctx, in) -> OUTPUT).execute(ActivityContext.create("x"), INPUT);

      assertThat(output).isEqualTo(OUTPUT);
    }

    @Test
    @DisplayName("Open circuit should surface as a transient error after retries")
    void testCircuitBreakerInChain() {
      CircuitBreaker breaker = new CircuitBreaker("payment:charge", 0.5, Duration.ofMinutes(1));
      ActivityFunction fn =
          builder
              .circuitBreaker(breaker)
              .build(
                  (ctx, in) -> {
                    invocations.incrementAndGet();
                    throw Status.UNAVAILABLE.asRuntimeException();
                  });

      assertThatThrownBy(() -> fn.execute(ActivityContext.create("payment:charge"), INPUT))
          .isInstanceOf(ClassifiedException.class);
      assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

      assertThatThrownBy(() -> fn.execute(ActivityContext.create("payment:charge"), INPUT))
          .isInstanceOfSatisfying(
              ClassifiedException.class,
              e -> assertThat(e.getCode()).isEqualTo(CircuitBreaker.CIRCUIT_BREAKER_OPEN));
      assertThat(invocations).hasValue(3);
    }

    @Test
    @DisplayName("Timeout should bound the whole retry sequence, backoff waits included")
    void testTimeoutBoundsRetries() {
      AtomicInteger calls = new AtomicInteger();
      RetryPolicy slow = new RetryPolicy(5, Duration.ofMillis(200), Duration.ofSeconds(1), 2.0);
      ActivityFunction fn =
          ActivityPipeline.builder("payment:charge")
              .timeout(Duration.ofMillis(300))
              .retry(slow)
              .build(
                  (ctx, in) -> {
                    calls.incrementAndGet();
                    throw new TransientException("GATEWAY_BUSY", "try again");
                  });

      long start = System.nanoTime();
      assertThatThrownBy(() -> fn.execute(ActivityContext.create("payment:charge"), INPUT))
          .isInstanceOfSatisfying(
              ClassifiedException.class,
              e -> assertThat(e.getCode()).isEqualTo(TimeoutMiddleware.ACTIVITY_TIMEOUT));
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

      assertThat(elapsed).isLessThan(Duration.ofMillis(1500));
      assertThat(calls.get()).isBetween(1, slow.maxAttempts() - 1);
    }

    @Test
    @DisplayName("Classification should always be the innermost stage")
    void testChainComposition() {
      List<ActivityMiddleware> chain =
          ActivityPipeline.builder("x").retry(FAST).timeout(Duration.ofSeconds(1)).middlewares();

      assertThat(chain)
          .extracting(m -> m.getClass().getSimpleName())
          .containsExactly(
              "TimeoutMiddleware", "RetryMiddleware", "ErrorClassificationMiddleware");
    }
  }
}
