package com.farmcrm.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import org.tinylog.Logger;

/** Builds the process-wide connection pool. */
public final class DataSources {

  static final String POOL_NAME = "FarmCrmPool";
  static final Duration KEEPALIVE = Duration.ofMinutes(5);

  private DataSources() {
    // Utility class, no instances
  }

  /** Translates a {@link DatabaseConfig} into HikariCP settings. */
  public static HikariConfig toHikariConfig(DatabaseConfig db) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(db.jdbcUrl());
    if (db.username() != null) {
      config.setUsername(db.username());
    }
    if (db.password() != null) {
      config.setPassword(db.password());
    }
    config.setMinimumIdle(db.poolSize());
    config.setMaximumPoolSize(db.maximumPoolSize());
    config.setMaxLifetime(db.recycle().toMillis());
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    // Start even when the database is down; the health check reports it.
    config.setInitializationFailTimeout(-1);
    config.setPoolName(POOL_NAME);
    if (db.prePing()) {
      config.setConnectionTestQuery("SELECT 1");
      config.setKeepaliveTime(KEEPALIVE.toMillis());
    }
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    return config;
  }

  /**
   * Creates the connection pool. Call once per process and pass the result to the services that
   * need it.
   */
  public static HikariDataSource create(DatabaseConfig db) {
    Logger.info("Initializing database connection pool: {}", db.toSecureString());
    return new HikariDataSource(toHikariConfig(db));
  }
}
