package com.acme.orchestrator.persistence.jdbc;

import com.acme.orchestrator.config.StorageConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * PostgreSQL implementation of the task event store. The payload column is JSONB; JSON fields are
 * read with the ->> operator.
 */
@Singleton
@Requires(property = "storage.dialect", value = "POSTGRES")
public class PostgresTaskEventRepository extends JdbcTaskEventRepository {

  public PostgresTaskEventRepository(DataSource dataSource, StorageConfig config) {
    super(dataSource, config);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO task_events
        (timestamp, trace_id, span_id, orchestration_id, event_type, activity, payload)
        VALUES (?, ?, ?, ?, ?, ?, ?::jsonb)
        """;
  }

  @Override
  protected String getFindActivityPerformanceSql() {
    return """
        SELECT activity,
               COUNT(*) AS cnt,
               AVG((payload->>'latency_ms')::bigint) AS avg_ms,
               MAX((payload->>'latency_ms')::bigint) AS max_ms,
               MIN((payload->>'latency_ms')::bigint) AS min_ms
        FROM task_events
        WHERE event_type = 'trace'
          AND activity IS NOT NULL
          AND payload->>'latency_ms' IS NOT NULL
          AND timestamp > ?
        GROUP BY activity
        HAVING MAX((payload->>'latency_ms')::bigint) > ?
        ORDER BY avg_ms DESC
        """;
  }

  @Override
  protected String getFindErrorEventsSql() {
    return """
        SELECT id, timestamp, trace_id, span_id, orchestration_id, event_type, activity, payload
        FROM task_events
        WHERE payload->>'error' IS NOT NULL
           OR payload->>'span_status' IN ('ERROR', 'STATUS_CODE_ERROR')
        ORDER BY timestamp DESC, id DESC
        LIMIT ?
        """;
  }
}
