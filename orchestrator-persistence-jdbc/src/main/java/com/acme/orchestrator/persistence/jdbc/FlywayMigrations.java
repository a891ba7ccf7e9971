package com.acme.orchestrator.persistence.jdbc;

import com.acme.orchestrator.config.StorageConfig;
import java.util.Locale;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Applies the telemetry schema migrations for a dialect. */
public class FlywayMigrations {

  private static final Logger LOG = LoggerFactory.getLogger(FlywayMigrations.class);

  private FlywayMigrations() {}

  public static String locationFor(StorageConfig.Dialect dialect) {
    return "classpath:db/migration/" + dialect.name().toLowerCase(Locale.ROOT);
  }

  /**
   * Migrates the schema behind {@code dataSource} to the latest version.
   *
   * @return number of migrations applied by this call
   */
  public static int migrate(DataSource dataSource, StorageConfig.Dialect dialect) {
    Flyway flyway =
        Flyway.configure().dataSource(dataSource).locations(locationFor(dialect)).load();
    MigrateResult result = flyway.migrate();
    LOG.info(
        "Telemetry schema migrated for {}: {} migrations applied, now at version {}",
        dialect,
        result.migrationsExecuted,
        result.targetSchemaVersion);
    return result.migrationsExecuted;
  }
}
