package com.acme.orchestrator.config;

import com.acme.orchestrator.persistence.jdbc.FlywayMigrations;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the telemetry store connection pool and migrates its schema before any repository uses
 * it. The repositories themselves are annotated beans of the persistence module.
 */
@Factory
public class StorageBeansFactory {

  private static final Logger LOG = LoggerFactory.getLogger(StorageBeansFactory.class);

  @Singleton
  public HikariDataSource dataSource(StorageConfig storage) {
    if (storage.getDialect() == StorageConfig.Dialect.SQLITE) {
      createParentDirectory(storage.getSqliteFile());
    }

    HikariConfig config = new HikariConfig();
    config.setPoolName("telemetry");
    config.setJdbcUrl(storage.resolveJdbcUrl());
    if (storage.getUsername() != null) {
      config.setUsername(storage.getUsername());
    }
    if (storage.getPassword() != null) {
      config.setPassword(storage.getPassword());
    }
    config.setMaximumPoolSize(storage.getMaxPoolSize());

    HikariDataSource dataSource = new HikariDataSource(config);
    try {
      FlywayMigrations.migrate(dataSource, storage.getDialect());
    } catch (RuntimeException e) {
      dataSource.close();
      throw e;
    }
    LOG.info("Telemetry store ready: {} ({})", storage.resolveJdbcUrl(), storage.getDialect());
    return dataSource;
  }

  private static void createParentDirectory(String file) {
    Path parent = Path.of(file).toAbsolutePath().getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create directory for SQLite file " + file, e);
    }
  }
}
