package com.acme.orchestrator.persistence.jdbc;

import com.acme.orchestrator.config.StorageConfig;
import com.acme.orchestrator.persistence.jdbc.mapper.TelemetryEventMapper;
import com.acme.orchestrator.repository.ActivityStats;
import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.telemetry.EventType;
import com.acme.orchestrator.telemetry.TelemetryEvent;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of EventRepository using Template Method pattern. Subclasses
 * provide the statements that touch the JSON payload, which differ per database.
 */
public abstract class JdbcTaskEventRepository extends BatchedJdbcRepository<TelemetryEvent>
    implements EventRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcTaskEventRepository.class);
  static final int MAX_EVENT_RESULTS = 1000;

  protected JdbcTaskEventRepository(DataSource dataSource, StorageConfig config) {
    super(dataSource, config);
  }

  @Override
  public void write(TelemetryEvent event) {
    append(event);
  }

  @Override
  public List<TelemetryEvent> findByTraceId(String traceId) {
    return query(
        getFindByTraceIdSql(),
        ps -> ps.setString(1, traceId),
        TelemetryEventMapper::toEvent,
        "find events by trace id");
  }

  @Override
  public List<TelemetryEvent> findByOrchestrationId(String orchestrationId) {
    return query(
        getFindByOrchestrationIdSql(),
        ps -> ps.setString(1, orchestrationId),
        TelemetryEventMapper::toEvent,
        "find events by orchestration id");
  }

  @Override
  public List<TelemetryEvent> findByEventType(EventType eventType) {
    if (eventType == null) {
      throw new IllegalArgumentException("eventType must not be null");
    }
    return query(
        getFindByEventTypeSql(),
        ps -> {
          ps.setString(1, eventType.value());
          ps.setInt(2, MAX_EVENT_RESULTS);
        },
        TelemetryEventMapper::toEvent,
        "find events by type");
  }

  @Override
  public List<ActivityStats> findActivityPerformance(long thresholdMs, Duration window) {
    return query(
        getFindActivityPerformanceSql(),
        ps -> {
          ps.setTimestamp(1, cutoff(window));
          ps.setLong(2, thresholdMs);
        },
        rs ->
            new ActivityStats(
                rs.getString("activity"),
                rs.getLong("cnt"),
                rs.getDouble("avg_ms"),
                rs.getLong("max_ms"),
                rs.getLong("min_ms")),
        "find activity performance");
  }

  @Override
  public List<TelemetryEvent> findErrorEvents(int limit) {
    requirePositive(limit, "limit");
    return query(
        getFindErrorEventsSql(),
        ps -> ps.setInt(1, limit),
        TelemetryEventMapper::toEvent,
        "find error events");
  }

  @Override
  public int pruneOlderThan(Duration age) {
    int deleted =
        update(getPruneSql(), ps -> ps.setTimestamp(1, cutoff(age)), "prune task events");
    LOG.info("Pruned {} task events older than {}", deleted, age);
    return deleted;
  }

  @Override
  protected String getTableName() {
    return "task_events";
  }

  @Override
  protected void bindInsert(PreparedStatement ps, TelemetryEvent row) throws SQLException {
    TelemetryEventMapper.bindInsert(ps, row);
  }

  protected String getFindByTraceIdSql() {
    return """
        SELECT id, timestamp, trace_id, span_id, orchestration_id, event_type, activity, payload
        FROM task_events
        WHERE trace_id = ?
        ORDER BY id ASC
        """;
  }

  protected String getFindByOrchestrationIdSql() {
    return """
        SELECT id, timestamp, trace_id, span_id, orchestration_id, event_type, activity, payload
        FROM task_events
        WHERE orchestration_id = ?
        ORDER BY id ASC
        """;
  }

  protected String getFindByEventTypeSql() {
    return """
        SELECT id, timestamp, trace_id, span_id, orchestration_id, event_type, activity, payload
        FROM task_events
        WHERE event_type = ?
        ORDER BY timestamp DESC, id DESC
        LIMIT ?
        """;
  }

  protected String getPruneSql() {
    return "DELETE FROM task_events WHERE timestamp < ?";
  }

  // Dialect-specific statements

  @Override
  protected abstract String getInsertSql();

  /** Parameters: window start, latency threshold in ms. */
  protected abstract String getFindActivityPerformanceSql();

  /** Parameter: row limit. */
  protected abstract String getFindErrorEventsSql();
}
