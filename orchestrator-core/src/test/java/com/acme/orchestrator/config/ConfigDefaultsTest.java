package com.acme.orchestrator.config;

import static org.assertj.core.api.Assertions.*;

import com.acme.orchestrator.pipeline.RetryPolicy;
import com.acme.orchestrator.telemetry.LogLevel;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConfigDefaultsTest {

  @Test
  @DisplayName("ActivitiesConfig defaults")
  void testActivitiesDefaults() {
    ActivitiesConfig config = new ActivitiesConfig();

    assertThat(config.getRetryMaxAttempts()).isEqualTo(3);
    assertThat(config.getTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.getCircuitBreakerThreshold()).isEqualTo(0.5);
    assertThat(config.getCircuitBreakerTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(RetryPolicy.from(config)).isEqualTo(RetryPolicy.defaults(3));
  }

  @Test
  @DisplayName("ObservabilityConfig defaults")
  void testObservabilityDefaults() {
    ObservabilityConfig config = new ObservabilityConfig();

    assertThat(config.getPersistedLevel()).isEqualTo(LogLevel.INFO);
    assertThat(config.getOtlpHost()).isEqualTo("localhost");
    assertThat(config.getOtlpPort()).isEqualTo(4317);
    assertThat(config.isTracingEnabled()).isFalse();
  }

  @Test
  @DisplayName("StorageConfig should derive a SQLite URL unless one is set")
  void testStorageUrl() {
    StorageConfig config = new StorageConfig();

    assertThat(config.getBatchSize()).isEqualTo(100);
    assertThat(config.getFlushInterval()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.resolveJdbcUrl())
        .isEqualTo("jdbc:sqlite:data/orchestration.db?busy_timeout=5000");

    config.setJdbcUrl("jdbc:postgresql://localhost/telemetry");
    assertThat(config.resolveJdbcUrl()).isEqualTo("jdbc:postgresql://localhost/telemetry");
  }
}
