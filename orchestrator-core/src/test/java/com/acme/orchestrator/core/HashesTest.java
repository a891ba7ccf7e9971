package com.acme.orchestrator.core;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HashesTest {

  @Test
  @DisplayName("hashError should group errors by the code before the first colon")
  void testErrorHashGrouping() {
    String timeout = Hashes.hashError("PAYMENT_FAILED: timeout");
    String network = Hashes.hashError("PAYMENT_FAILED: network_error");

    assertThat(timeout).isEqualTo(network).hasSize(16).matches("[0-9a-f]{16}");
    assertThat(Hashes.hashError("PAYMENT_FAILED")).isEqualTo(timeout);
    assertThat(Hashes.hashError("INVENTORY_FAILED: timeout")).isNotEqualTo(timeout);
  }

  @Test
  @DisplayName("hashError should return empty string for empty input")
  void testEmptyError() {
    assertThat(Hashes.hashError("")).isEmpty();
    assertThat(Hashes.hashError(null)).isEmpty();
  }

  @Test
  @DisplayName("hashData should be the hex SHA-256 of the bytes")
  void testDataHash() {
    byte[] data = "hello".getBytes(StandardCharsets.UTF_8);

    assertThat(Hashes.hashData(data))
        .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824")
        .isEqualTo(Hashes.hashData("hello".getBytes(StandardCharsets.UTF_8)));
    assertThat(Hashes.hashData("hello!".getBytes(StandardCharsets.UTF_8)))
        .isNotEqualTo(Hashes.hashData(data));
  }

  @Test
  @DisplayName("TraceIds should generate 32 and 16 hex character identifiers")
  void testTraceIds() {
    assertThat(TraceIds.generate()).matches("[0-9a-f]{32}");
    assertThat(TraceIds.generateSpanId()).matches("[0-9a-f]{16}");
    assertThat(TraceIds.generate()).isNotEqualTo(TraceIds.generate());
  }
}
