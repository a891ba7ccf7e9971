package com.acme.orchestrator.repository;

import com.acme.orchestrator.telemetry.LogRecord;
import java.time.Duration;
import java.util.List;

/**
 * Buffered store for {@link LogRecord}s. Writes are batched; queries only see flushed records.
 */
public interface LogRepository extends AutoCloseable {

  /**
   * Appends a record to the pending batch, flushing synchronously once the batch is full.
   *
   * @throws IllegalStateException if the repository has been closed
   */
  void write(LogRecord record);

  /** Persists all pending records in one transaction. A failed flush keeps them pending. */
  void flush();

  int pendingCount();

  /** Records of one trace, oldest first. */
  List<LogRecord> findByTraceId(String traceId);

  /** Records of one orchestration, oldest first. */
  List<LogRecord> findByOrchestrationId(String orchestrationId);

  /** Up to 1000 records with the given error hash, newest first. */
  List<LogRecord> findErrorsByHash(String errorHash);

  /**
   * Activities whose slowest execution in the trailing {@code window} exceeded {@code thresholdMs},
   * ordered by average duration, slowest first.
   */
  List<ActivityStats> findSlowActivities(long thresholdMs, int limit, Duration window);

  /** Most frequent error groups, most frequent first. */
  List<ErrorFrequency> findErrorFrequency(int limit);

  /**
   * Deletes records older than {@code age}.
   *
   * @return number of deleted rows
   */
  int pruneOlderThan(Duration age);

  /** Stops the flush timer, flushes what is pending and rejects further writes. */
  @Override
  void close();
}
