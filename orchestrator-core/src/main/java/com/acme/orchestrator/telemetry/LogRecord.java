package com.acme.orchestrator.telemetry;

import com.acme.orchestrator.core.Hashes;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Structured log entry persisted to the {@code logs} table. Immutable: every {@code with...} method
 * returns a modified copy. {@code id} is null until the record has been read back from storage.
 */
public record LogRecord(
    Long id,
    Instant timestamp,
    LogLevel level,
    String traceId,
    String spanId,
    String orchestrationId,
    String activity,
    String message,
    long durationMs,
    String inputHash,
    String outputHash,
    String errorMessage,
    String errorHash) {

  public LogRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
  }

  public static LogRecord of(LogLevel level, String traceId, String message) {
    return new LogRecord(
        null, Instant.now(), level, traceId, null, null, null, message, 0, null, null, null, null);
  }

  public LogRecord withSpanId(String spanId) {
    return new LogRecord(
        id, timestamp, level, traceId, spanId, orchestrationId, activity, message, durationMs,
        inputHash, outputHash, errorMessage, errorHash);
  }

  public LogRecord withOrchestrationId(String orchestrationId) {
    return new LogRecord(
        id, timestamp, level, traceId, spanId, orchestrationId, activity, message, durationMs,
        inputHash, outputHash, errorMessage, errorHash);
  }

  public LogRecord withActivity(String activity) {
    return new LogRecord(
        id, timestamp, level, traceId, spanId, orchestrationId, activity, message, durationMs,
        inputHash, outputHash, errorMessage, errorHash);
  }

  public LogRecord withDuration(Duration duration) {
    return new LogRecord(
        id, timestamp, level, traceId, spanId, orchestrationId, activity, message,
        duration.toMillis(), inputHash, outputHash, errorMessage, errorHash);
  }

  /** Stores the SHA-256 fingerprint of the input. Empty input leaves the hash unset. */
  public LogRecord withInput(byte[] input) {
    if (input == null || input.length == 0) {
      return this;
    }
    return new LogRecord(
        id, timestamp, level, traceId, spanId, orchestrationId, activity, message, durationMs,
        Hashes.hashData(input), outputHash, errorMessage, errorHash);
  }

  /** Stores the SHA-256 fingerprint of the output. Empty output leaves the hash unset. */
  public LogRecord withOutput(byte[] output) {
    if (output == null || output.length == 0) {
      return this;
    }
    return new LogRecord(
        id, timestamp, level, traceId, spanId, orchestrationId, activity, message, durationMs,
        inputHash, Hashes.hashData(output), errorMessage, errorHash);
  }

  /** Sets the error text and its grouping hash. An empty message leaves the record unchanged. */
  public LogRecord withError(String error) {
    if (error == null || error.isEmpty()) {
      return this;
    }
    return new LogRecord(
        id, timestamp, level, traceId, spanId, orchestrationId, activity, message, durationMs,
        inputHash, outputHash, error, Hashes.hashError(error));
  }

  public boolean hasError() {
    return errorMessage != null && !errorMessage.isEmpty();
  }
}
