package com.acme.cqrs.runtime;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pooled {@link DataSource} for the JDBC event and snapshot stores, migrated with Flyway before
 * first use. Active only when {@code db.dialect} is set.
 */
@Factory
@Requires(property = "db.dialect")
public class PersistenceFactory {
  private static final Logger log = LoggerFactory.getLogger(PersistenceFactory.class);

  @Singleton
  @ConfigurationProperties("db")
  public DatabaseConfig databaseConfig() {
    return new DatabaseConfig();
  }

  @Singleton
  @Bean(preDestroy = "close")
  public HikariDataSource dataSource(DatabaseConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.getUrl());
    hikari.setUsername(config.getUsername());
    hikari.setPassword(config.getPassword());
    hikari.setMaximumPoolSize(config.getMaximumPoolSize());
    hikari.setPoolName("cqrs-" + config.getDialect().toLowerCase());
    HikariDataSource dataSource = new HikariDataSource(hikari);

    if (config.isMigrate()) {
      migrate(dataSource, config.migrationLocation());
    }
    return dataSource;
  }

  static void migrate(DataSource dataSource, String location) {
    int applied = Flyway.configure().dataSource(dataSource).locations(location).load().migrate()
        .migrationsExecuted;
    log.info("Applied {} migrations from {}", applied, location);
  }
}
