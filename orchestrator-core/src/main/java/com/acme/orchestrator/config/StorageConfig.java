package com.acme.orchestrator.config;

import java.time.Duration;

/**
 * Telemetry store settings: connection, batching and retention. Pure POJO - no framework
 * dependencies.
 */
public class StorageConfig {

  public enum Dialect {
    SQLITE,
    POSTGRES
  }

  private Dialect dialect = Dialect.SQLITE;
  private String sqliteFile = "data/orchestration.db";
  private String jdbcUrl; // Derived from sqliteFile when unset
  private String username;
  private String password;
  private int maxPoolSize = 25;
  private int batchSize = 100;
  private Duration flushInterval = Duration.ofSeconds(5);
  private Duration retention = Duration.ofDays(7);

  public Dialect getDialect() {
    return dialect;
  }

  public void setDialect(Dialect dialect) {
    this.dialect = dialect;
  }

  public String getSqliteFile() {
    return sqliteFile;
  }

  public void setSqliteFile(String sqliteFile) {
    this.sqliteFile = sqliteFile;
  }

  public String getJdbcUrl() {
    return jdbcUrl;
  }

  public void setJdbcUrl(String jdbcUrl) {
    this.jdbcUrl = jdbcUrl;
  }

  /** Explicit JDBC URL, or a SQLite URL for {@code sqliteFile} with a busy timeout. */
  public String resolveJdbcUrl() {
    if (jdbcUrl != null && !jdbcUrl.isBlank()) {
      return jdbcUrl;
    }
    return "jdbc:sqlite:" + sqliteFile + "?busy_timeout=5000";
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public int getMaxPoolSize() {
    return maxPoolSize;
  }

  public void setMaxPoolSize(int maxPoolSize) {
    this.maxPoolSize = maxPoolSize;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getFlushInterval() {
    return flushInterval;
  }

  public void setFlushInterval(Duration flushInterval) {
    this.flushInterval = flushInterval;
  }

  public Duration getRetention() {
    return retention;
  }

  public void setRetention(Duration retention) {
    this.retention = retention;
  }
}
