package com.acme.orchestrator.persistence.jdbc;

import com.acme.orchestrator.config.StorageConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** SQLite implementation of the task event store. JSON fields are read with json_extract. */
@Singleton
@Requires(property = "storage.dialect", value = "SQLITE", defaultValue = "SQLITE")
public class SqliteTaskEventRepository extends JdbcTaskEventRepository {

  public SqliteTaskEventRepository(DataSource dataSource, StorageConfig config) {
    super(dataSource, config);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO task_events
        (timestamp, trace_id, span_id, orchestration_id, event_type, activity, payload)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getFindActivityPerformanceSql() {
    return """
        SELECT activity,
               COUNT(*) AS cnt,
               AVG(CAST(json_extract(payload, '$.latency_ms') AS INTEGER)) AS avg_ms,
               MAX(CAST(json_extract(payload, '$.latency_ms') AS INTEGER)) AS max_ms,
               MIN(CAST(json_extract(payload, '$.latency_ms') AS INTEGER)) AS min_ms
        FROM task_events
        WHERE event_type = 'trace'
          AND activity IS NOT NULL
          AND json_extract(payload, '$.latency_ms') IS NOT NULL
          AND timestamp > ?
        GROUP BY activity
        HAVING MAX(CAST(json_extract(payload, '$.latency_ms') AS INTEGER)) > ?
        ORDER BY avg_ms DESC
        """;
  }

  @Override
  protected String getFindErrorEventsSql() {
    return """
        SELECT id, timestamp, trace_id, span_id, orchestration_id, event_type, activity, payload
        FROM task_events
        WHERE json_extract(payload, '$.error') IS NOT NULL
           OR json_extract(payload, '$.span_status') IN ('ERROR', 'STATUS_CODE_ERROR')
        ORDER BY timestamp DESC, id DESC
        LIMIT ?
        """;
  }
}
