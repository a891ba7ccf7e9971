package com.acme.orchestrator.persistence.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

/**
 * Base class for SQLite-based repository exception tests. Sets up an in-memory database WITHOUT
 * any tables so every statement fails with SQLException.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class SqliteRepositoryFaultyTestBase {

  protected HikariDataSource dataSource;

  @BeforeAll
  void setupFaultySchema() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:sqlite::memory:");
    config.setMaximumPoolSize(2);

    dataSource = new HikariDataSource(config);
    // Note: No Flyway migration, so tables don't exist
  }

  @AfterAll
  void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  protected DataSource getDataSource() {
    return dataSource;
  }
}
