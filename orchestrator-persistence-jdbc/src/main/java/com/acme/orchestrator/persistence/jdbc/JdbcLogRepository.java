package com.acme.orchestrator.persistence.jdbc;

import com.acme.orchestrator.config.StorageConfig;
import com.acme.orchestrator.persistence.jdbc.mapper.LogRecordMapper;
import com.acme.orchestrator.repository.ActivityStats;
import com.acme.orchestrator.repository.ErrorFrequency;
import com.acme.orchestrator.repository.LogRepository;
import com.acme.orchestrator.telemetry.LogRecord;
import jakarta.inject.Singleton;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batched JDBC implementation of {@link LogRepository}. The statements are portable between SQLite
 * and PostgreSQL, so there is no dialect subclass.
 */
@Singleton
public class JdbcLogRepository extends BatchedJdbcRepository<LogRecord> implements LogRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcLogRepository.class);
  static final int MAX_ERROR_RESULTS = 1000;

  public JdbcLogRepository(DataSource dataSource, StorageConfig config) {
    super(dataSource, config);
  }

  @Override
  public void write(LogRecord record) {
    append(record);
  }

  @Override
  public List<LogRecord> findByTraceId(String traceId) {
    return query(
        getFindByTraceIdSql(),
        ps -> ps.setString(1, traceId),
        LogRecordMapper::toRecord,
        "find logs by trace id");
  }

  @Override
  public List<LogRecord> findByOrchestrationId(String orchestrationId) {
    return query(
        getFindByOrchestrationIdSql(),
        ps -> ps.setString(1, orchestrationId),
        LogRecordMapper::toRecord,
        "find logs by orchestration id");
  }

  @Override
  public List<LogRecord> findErrorsByHash(String errorHash) {
    return query(
        getFindErrorsByHashSql(),
        ps -> {
          ps.setString(1, errorHash);
          ps.setInt(2, MAX_ERROR_RESULTS);
        },
        LogRecordMapper::toRecord,
        "find logs by error hash");
  }

  @Override
  public List<ActivityStats> findSlowActivities(long thresholdMs, int limit, Duration window) {
    requirePositive(limit, "limit");
    return query(
        getFindSlowActivitiesSql(),
        ps -> {
          ps.setTimestamp(1, cutoff(window));
          ps.setLong(2, thresholdMs);
          ps.setInt(3, limit);
        },
        rs ->
            new ActivityStats(
                rs.getString("activity"),
                rs.getLong("cnt"),
                rs.getDouble("avg_ms"),
                rs.getLong("max_ms"),
                rs.getLong("min_ms")),
        "find slow activities");
  }

  @Override
  public List<ErrorFrequency> findErrorFrequency(int limit) {
    requirePositive(limit, "limit");
    return query(
        getFindErrorFrequencySql(),
        ps -> ps.setInt(1, limit),
        rs ->
            new ErrorFrequency(
                rs.getString("error_hash"),
                rs.getString("sample_message"),
                rs.getLong("frequency")),
        "find error frequency");
  }

  @Override
  public int pruneOlderThan(Duration age) {
    int deleted = update(getPruneSql(), ps -> ps.setTimestamp(1, cutoff(age)), "prune logs");
    LOG.info("Pruned {} log records older than {}", deleted, age);
    return deleted;
  }

  @Override
  protected String getTableName() {
    return "logs";
  }

  @Override
  protected void bindInsert(PreparedStatement ps, LogRecord row) throws SQLException {
    LogRecordMapper.bindInsert(ps, row);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO logs
        (timestamp, level, trace_id, span_id, orchestration_id, activity, message, duration_ms,
         input_hash, output_hash, error_message, error_hash, raw_json)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
  }

  protected String getFindByTraceIdSql() {
    return """
        SELECT id, timestamp, level, trace_id, span_id, orchestration_id, activity, message,
               duration_ms, input_hash, output_hash, error_message, error_hash
        FROM logs
        WHERE trace_id = ?
        ORDER BY id ASC
        """;
  }

  protected String getFindByOrchestrationIdSql() {
    return """
        SELECT id, timestamp, level, trace_id, span_id, orchestration_id, activity, message,
               duration_ms, input_hash, output_hash, error_message, error_hash
        FROM logs
        WHERE orchestration_id = ?
        ORDER BY id ASC
        """;
  }

  protected String getFindErrorsByHashSql() {
    return """
        SELECT id, timestamp, level, trace_id, span_id, orchestration_id, activity, message,
               duration_ms, input_hash, output_hash, error_message, error_hash
        FROM logs
        WHERE error_hash = ?
        ORDER BY timestamp DESC, id DESC
        LIMIT ?
        """;
  }

  protected String getFindSlowActivitiesSql() {
    return """
        SELECT activity,
               COUNT(*) AS cnt,
               AVG(duration_ms) AS avg_ms,
               MAX(duration_ms) AS max_ms,
               MIN(duration_ms) AS min_ms
        FROM logs
        WHERE activity IS NOT NULL
          AND duration_ms > 0
          AND timestamp > ?
        GROUP BY activity
        HAVING MAX(duration_ms) > ?
        ORDER BY avg_ms DESC
        LIMIT ?
        """;
  }

  protected String getFindErrorFrequencySql() {
    return """
        SELECT error_hash,
               MIN(error_message) AS sample_message,
               COUNT(*) AS frequency
        FROM logs
        WHERE error_hash IS NOT NULL AND error_hash <> ''
        GROUP BY error_hash
        ORDER BY frequency DESC, error_hash ASC
        LIMIT ?
        """;
  }

  protected String getPruneSql() {
    return "DELETE FROM logs WHERE timestamp < ?";
  }
}
