package com.acme.orchestrator.activity;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.orchestrator.config.ActivitiesConfig;
import com.acme.orchestrator.core.ClassifiedException;
import com.acme.orchestrator.core.PermanentException;
import com.acme.orchestrator.core.TransientException;
import com.acme.orchestrator.pipeline.ActivityContext;
import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.repository.LogRepository;
import com.acme.orchestrator.telemetry.ActivityLogger;
import com.acme.orchestrator.telemetry.LogLevel;
import com.acme.orchestrator.telemetry.LogRecord;
import com.acme.orchestrator.telemetry.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Unit tests for ActivityRegistry */
class ActivityRegistryTest {

  private ActivitiesConfig config;
  private LogRepository logRepository;
  private ActivityRegistry registry;

  @BeforeEach
  void setUp() {
    config = new ActivitiesConfig();
    config.setRetryInitialBackoff(Duration.ofMillis(1));
    config.setRetryMaxBackoff(Duration.ofMillis(5));
    config.setTimeout(Duration.ofSeconds(5));
    logRepository = mock(LogRepository.class);
    ActivityLogger activityLogger =
        new ActivityLogger(LogLevel.INFO, logRepository, mock(EventRepository.class));
    registry =
        new ActivityRegistry(
            config, activityLogger, new MetricsCollector(new SimpleMeterRegistry()));
  }

  @Nested
  @DisplayName("Registration Tests")
  class RegistrationTests {

    @Test
    @DisplayName("register - should expose registered names in sorted order")
    void testRegister() {
      registry.register("payment:refund", (ctx, in) -> in);
      registry.register("payment:charge", (ctx, in) -> in);

      assertThat(registry.names()).containsExactly("payment:charge", "payment:refund");
      assertThat(registry.contains("payment:charge")).isTrue();
    }

    @Test
    @DisplayName("register - should reject duplicate names")
    void testDuplicate() {
      registry.register("payment:charge", (ctx, in) -> in);

      assertThatThrownBy(() -> registry.register("payment:charge", (ctx, in) -> in))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("Activity already registered: payment:charge");
    }
  }

  @Nested
  @DisplayName("Execution Tests")
  class ExecutionTests {

    @Test
    @DisplayName("execute - should run the activity through the standard pipeline")
    void testExecute() {
      registry.register(
          "echo", (ctx, in) -> ("echo:" + new String(in, StandardCharsets.UTF_8)).getBytes());

      byte[] output =
          registry.execute(
              "echo", ActivityContext.create("caller", "trace-1", "orch-1"), "hi".getBytes());

      assertThat(new String(output, StandardCharsets.UTF_8)).isEqualTo("echo:hi");
      ArgumentCaptor<LogRecord> records = ArgumentCaptor.forClass(LogRecord.class);
      verify(logRepository, times(2)).write(records.capture());
      assertThat(records.getAllValues())
          .allSatisfy(
              r -> {
                assertThat(r.activity()).isEqualTo("echo");
                assertThat(r.traceId()).isEqualTo("trace-1");
              });
    }

    @Test
    @DisplayName("execute - should retry transient failures up to the configured attempts")
    void testRetries() {
      AtomicInteger calls = new AtomicInteger();
      registry.register(
          "flaky",
          (ctx, in) -> {
            if (calls.incrementAndGet() < 3) {
              throw new TransientException("BUSY", "later");
            }
            return in;
          });

      assertThat(registry.execute("flaky", new byte[] {1})).containsExactly(1);
      assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("execute - should fail with ACTIVITY_NOT_FOUND for unknown names")
    void testUnknown() {
      assertThatThrownBy(() -> registry.execute("missing", new byte[0]))
          .isInstanceOfSatisfying(
              PermanentException.class,
              e -> assertThat(e.getCode()).isEqualTo(ActivityRegistry.ACTIVITY_NOT_FOUND));
    }

    @Test
    @DisplayName("execute - should classify raw failures")
    void testRawFailure() {
      registry.register(
          "broken",
          (ctx, in) -> {
            throw new IllegalStateException("boom");
          });

      assertThatThrownBy(() -> registry.execute("broken", new byte[0]))
          .isInstanceOfSatisfying(
              ClassifiedException.class, e -> assertThat(e.getCode()).isEqualTo("UNCLASSIFIED"));
    }
  }
}
