package com.farmcrm;

import com.farmcrm.common.status.StatusOr;
import com.farmcrm.config.DataSources;
import com.farmcrm.config.DatabaseConfig;
import com.farmcrm.db.FarmerSummary;
import com.zaxxer.hikari.HikariDataSource;
import java.util.List;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Connectivity check for the farmer CRM database.
 *
 * <p>Reads the connection settings from the environment (see {@link
 * DatabaseConfig#fromEnvironment}), runs the health check, then logs a few farmers and the row
 * count of every table. Exit status is 0 when the database answered, 1 when it did not and 2 when
 * the configuration is invalid.
 */
public class Main {

  static final int SAMPLE_SIZE = 5;

  static final int EXIT_OK = 0;
  static final int EXIT_UNHEALTHY = 1;
  static final int EXIT_BAD_CONFIG = 2;

  private final FarmerCrmService service;

  public Main(FarmerCrmService service) {
    this.service = service;
  }

  /** Runs the diagnostics and returns the process exit status. */
  public int run() {
    if (!service.healthCheck()) {
      Logger.error("Database is not reachable");
      return EXIT_UNHEALTHY;
    }

    StatusOr<List<FarmerSummary>> sampleOr = service.listFarmers(SAMPLE_SIZE);
    if (sampleOr.isOk()) {
      for (FarmerSummary farmer : sampleOr.getValue()) {
        Logger.info("Farmer {}: {} ({})", farmer.id(), farmer.farmName(), farmer.location());
      }
    }

    StatusOr<Map<String, Long>> countsOr = service.tableCounts();
    if (countsOr.isNotOk()) {
      return EXIT_UNHEALTHY;
    }
    countsOr.getValue().forEach((table, count) -> Logger.info("{}: {} rows", table, count));
    return EXIT_OK;
  }

  public static void main(String[] args) {
    DatabaseConfig dbConfig;
    try {
      dbConfig = DatabaseConfig.fromEnvironment(System.getenv());
    } catch (IllegalArgumentException e) {
      Logger.error("Invalid database configuration: {}", e.getMessage());
      System.exit(EXIT_BAD_CONFIG);
      return;
    }

    int status;
    try (HikariDataSource dataSource = DataSources.create(dbConfig)) {
      status = new Main(new FarmerCrmService(new FarmerCrmService.Config(dataSource))).run();
    }
    System.exit(status);
  }
}
