package com.farmcrm.db.util;

import com.google.common.io.Resources;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/** Starts a PostgreSQL test container loaded with the farmer CRM schema. */
public class PostgresTestHelper {

  private static final String SCHEMA_SQL_PATH = "db/schema.sql";

  /**
   * Creates a PostgreSQL container. The caller starts it.
   *
   * @param databaseName The name to use for the test database
   */
  public static PostgreSQLContainer<?> createPostgresContainer(String databaseName) {
    return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
        .withDatabaseName(databaseName)
        .withUsername("farmcrm")
        .withPassword("farmcrm");
  }

  /** Runs the schema script from the test classpath. */
  public static void initializeSchema(Connection connection) {
    URL schemaUrl = Resources.getResource(SCHEMA_SQL_PATH);
    try (Statement stmt = connection.createStatement()) {
      stmt.execute(Resources.toString(schemaUrl, StandardCharsets.UTF_8));
    } catch (IOException | SQLException e) {
      throw new IllegalStateException("Failed to initialize database schema", e);
    }
  }

  /**
   * Starts a container, loads the schema and returns a small pool connected to it.
   *
   * @param databaseName The name to use for the test database
   */
  public static PostgresContext setupPostgres(String databaseName) throws SQLException {
    PostgreSQLContainer<?> container = createPostgresContainer(databaseName);
    container.start();

    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(container.getJdbcUrl());
    config.setUsername(container.getUsername());
    config.setPassword(container.getPassword());
    config.setMaximumPoolSize(4);
    HikariDataSource dataSource = new HikariDataSource(config);

    try (Connection connection = dataSource.getConnection()) {
      initializeSchema(connection);
    }
    return new PostgresContext(container, dataSource);
  }

  /** Holds the running container and the pool connected to it. */
  public record PostgresContext(PostgreSQLContainer<?> container, HikariDataSource dataSource) {

    /** Closes the pool and stops the container. Call from test tearDown methods. */
    public void close() {
      if (dataSource != null) {
        dataSource.close();
      }
      if (container != null && container.isRunning()) {
        container.stop();
      }
    }
  }
}
