package org.groupscholar.planner.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.groupscholar.planner.api.PlannerCliSupport.ConfigFileException;
import org.groupscholar.planner.api.PlannerCliSupport.RunSettings;
import org.groupscholar.planner.config.DatabaseSettings;
import org.groupscholar.planner.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code planner seed}: plans a sample file with the fixed seed settings and stores the run, giving a fresh
 * database something to show.
 *
 * @since 0.1.0
 */
public final class SeedCli {
  private static final Logger log = LoggerFactory.getLogger(SeedCli.class);
  private static final String SUMMARY_USAGE =
      "usage: seed [in=PATH] [dbSchema=NAME] [runLabel=LABEL] [today=YYYY-MM-DD] [--verbose]";
  private static final String HELP_TEXT = """
      Intervention planner: seed

      Usage:
        seed [options]

      Options:
        in=PATH             Sample CSV (default data/sample.csv)
        dbSchema=NAME       Target schema (default intervention_planner)
        runLabel=LABEL      Run label (default <file stem>-<today>)
        today=YYYY-MM-DD    Evaluate as of this date (default: system date)
        config=PATH         YAML file with common/seed sections
        --verbose           Enable DEBUG logging
        --help              Show this message

      Scoring uses the standard thresholds with a 21-day forecast that includes overdue touches.
      Credentials come from GS_DB_DSN or GS_DB_HOST/GS_DB_PORT/GS_DB_NAME/GS_DB_USER/GS_DB_PASSWORD.
      """;

  private static final Set<String> ALLOWED_KEYS = Set.of(
      "in", "dbSchema", "runLabel", "today", "config", "metricsExporter", "otelEndpoint", "otelResourceAttributes");

  private SeedCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for seed");
    }

    RunSettings settings;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      for (String key : kv.keySet()) {
        if (!ALLOWED_KEYS.contains(key)) {
          throw new IllegalArgumentException("seed does not accept option: " + key);
        }
      }
      if (input.hasFlag("--dry-run")) {
        kv.put("dryRun", "true");
      }
      settings = PlannerCliSupport.resolve(PlannerCliSupport.effectiveSettings("seed", kv), true);
    } catch (ConfigFileException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid seed configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    DatabaseSettings database;
    try {
      database = PlannerCliSupport.databaseSettings();
    } catch (ConfigFileException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    ExitCode exit = PlannerCliSupport.execute(
        settings, PlannerCliSupport.outputs(settings, false, Optional.of(database))).exitCode();
    if (exit == ExitCode.SUCCESS) {
      CliPrinter.println("Seeded sample data into schema '" + settings.dbSchema() + "'.");
    }
    return exit;
  }
}
