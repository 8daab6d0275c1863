package org.groupscholar.planner.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.groupscholar.planner.application.pipeline.PlanUseCase;
import org.groupscholar.planner.application.port.ClockPort;
import org.groupscholar.planner.application.port.MetricsPort;
import org.groupscholar.planner.application.port.ReportOutputPort;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.config.ConfigMerger;
import org.groupscholar.planner.config.DatabaseSettings;
import org.groupscholar.planner.config.DefaultsForMode;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.config.YamlConfigLoader;
import org.groupscholar.planner.domain.aggregate.PlannerInvariantException;
import org.groupscholar.planner.infrastructure.console.ConsoleReportAdapter;
import org.groupscholar.planner.infrastructure.csv.CsvRecordSourceAdapter;
import org.groupscholar.planner.infrastructure.json.JsonReportFileAdapter;
import org.groupscholar.planner.infrastructure.metrics.NoOpMetricsAdapter;
import org.groupscholar.planner.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.groupscholar.planner.infrastructure.persistence.JdbcRunStoreAdapter;
import org.groupscholar.planner.infrastructure.time.SystemClockAdapter;
import org.groupscholar.planner.logging.LoggingConfigurator;
import org.groupscholar.planner.validation.Paths;
import org.groupscholar.planner.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings resolution, adapter wiring and exit-code mapping shared by {@link PlanCli} and {@link SeedCli}.
 */
final class PlannerCliSupport {
  private static final Logger log = LoggerFactory.getLogger(PlannerCliSupport.class);
  private static final String DB_MISSING =
      "Database settings missing. Set GS_DB_DSN or GS_DB_HOST/GS_DB_NAME/GS_DB_USER/GS_DB_PASSWORD.";

  private static volatile DatabaseSettings databaseOverride;
  private static volatile ClockPort clockOverride;

  private PlannerCliSupport() {}

  /**
   * Validated inputs for one command run.
   *
   * @param input CSV input file
   * @param json optional JSON report path
   * @param config planner configuration
   * @param today evaluation date
   * @param persist whether to write to the run store
   * @param dbSchema run store schema
   * @param runLabel run label stored with the run
   * @param otlp whether OTLP metrics export was selected
   */
  record RunSettings(
      Path input,
      Optional<Path> json,
      PlannerConfig config,
      LocalDate today,
      boolean persist,
      String dbSchema,
      String runLabel,
      boolean otlp) {}

  /**
   * Loads YAML settings and merges them with CLI values and mode defaults.
   *
   * @param mode {@code plan} or {@code seed}
   * @param cli CLI key/values; the {@code config} entry is consumed
   * @return effective settings
   * @throws ConfigFileException when the YAML file is missing or malformed
   * @throws IllegalArgumentException when merged settings are invalid
   */
  static Map<String, String> effectiveSettings(String mode, Map<String, String> cli) throws ConfigFileException {
    String configPath = ConfigCliUtils.extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath);
      if (!Files.isRegularFile(path)) {
        throw new ConfigFileException("config file not found: " + configPath, null);
      }
      try {
        yaml = YamlConfigLoader.load(path, mode);
      } catch (IOException | IllegalArgumentException ex) {
        throw new ConfigFileException("unable to load config " + configPath + ": " + ex.getMessage(), ex);
      }
      log.debug("Loaded {} YAML keys from {}", yaml.map(Map::size).orElse(0), configPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  /**
   * Validates effective settings into run settings.
   *
   * @throws IllegalArgumentException when a value is invalid
   */
  static RunSettings resolve(Map<String, String> effective, boolean checkInput) {
    if (ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    PlannerConfig config = PlannerConfig.fromMap(effective);
    Path input = Paths.parse("in", effective.get("in"));
    if (checkInput) {
      Paths.validateReadableFile("in", input);
    }
    Optional<Path> json = ConfigCliUtils.optional(effective, "json")
        .map(raw -> Paths.validateWritableFile("json", Paths.parse("json", raw)));
    LocalDate today = ConfigCliUtils.parseToday(effective).orElseGet(PlannerCliSupport::clockDate);
    String dbSchema = Strings.requireIdentifier(
        "dbSchema", effective.getOrDefault("dbSchema", DefaultsForMode.DEFAULT_DB_SCHEMA));
    String runLabel = ConfigCliUtils.optional(effective, "runLabel")
        .orElseGet(() -> defaultRunLabel(input, today));
    boolean otlp = TelemetryConfigurator.configureMetrics(effective);
    return new RunSettings(
        input, json, config, today, ConfigCliUtils.parseBoolean(effective, "persist"), dbSchema, runLabel, otlp);
  }

  /**
   * Default run label: input file stem plus the evaluation date.
   *
   * @param input input file
   * @param today evaluation date
   * @return label such as {@code sample-2024-04-01}
   */
  static String defaultRunLabel(Path input, LocalDate today) {
    String fileName = input.getFileName() == null ? "run" : input.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    return stem + "-" + today;
  }

  /**
   * Resolves run store settings from the environment.
   *
   * @throws ConfigFileException when no database settings are present or the DSN is malformed
   */
  static DatabaseSettings databaseSettings() throws ConfigFileException {
    DatabaseSettings override = databaseOverride;
    if (override != null) {
      return override;
    }
    try {
      return DatabaseSettings.fromEnvironment().orElseThrow(() -> new ConfigFileException(DB_MISSING, null));
    } catch (IllegalArgumentException ex) {
      throw new ConfigFileException("invalid database settings: " + ex.getMessage(), ex);
    }
  }

  /**
   * Runs the use case with the given outputs and maps failures to exit codes.
   *
   * @param settings validated settings
   * @param outputs report outputs in write order
   * @return exit code and, on success, the report
   */
  static Outcome execute(RunSettings settings, List<ReportOutputPort> outputs) {
    MetricsPort metrics = settings.otlp() ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
    try {
      PlanUseCase useCase = new PlanUseCase(
          new CsvRecordSourceAdapter(settings.input()), outputs, metrics, clock());
      PlanReport report = useCase.run(settings.config(), Optional.of(settings.today()));
      return new Outcome(ExitCode.SUCCESS, Optional.of(report));
    } catch (IOException ex) {
      log.error("Planner I/O failure: {}", ex.getMessage(), ex);
      return Outcome.failed(ExitCode.IO_ERROR);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid planner configuration: {}", ex.getMessage(), ex);
      return Outcome.failed(ExitCode.INVALID_ARGS);
    } catch (PlannerInvariantException ex) {
      log.error("Planner consistency check failed: {}", ex.getMessage(), ex);
      return Outcome.failed(ExitCode.RUNTIME_FAILURE);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in planner", ex);
      return Outcome.failed(ExitCode.RUNTIME_FAILURE);
    } catch (Exception ex) {
      log.error("Unexpected checked exception in planner", ex);
      return Outcome.failed(ExitCode.RUNTIME_FAILURE);
    } finally {
      if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
        otel.close();
      }
    }
  }

  /** Builds the output list for a run: console first, then JSON, then the run store. */
  static List<ReportOutputPort> outputs(
      RunSettings settings, boolean console, Optional<DatabaseSettings> database) {
    List<ReportOutputPort> outputs = new ArrayList<>();
    PlannerConfig config = settings.config();
    if (console) {
      outputs.add(new ConsoleReportAdapter(
          CliPrinter.lineSink(), config.limit(), config.ownerLimit(), config.explain()));
    }
    settings.json().ifPresent(path -> outputs.add(new JsonReportFileAdapter(path)));
    database.ifPresent(db -> {
      log.info("Persisting run '{}' to {}",
          settings.runLabel(), JdbcRunStoreAdapter.describe(db, settings.dbSchema()));
      outputs.add(new JdbcRunStoreAdapter(
          JdbcRunStoreAdapter.ConnectionFactory.fromSettings(db), settings.dbSchema(), settings.runLabel()));
    });
    return outputs;
  }

  /** Wall clock for {@code generatedAt} and the default {@code today}. */
  static ClockPort clock() {
    ClockPort override = clockOverride;
    return override != null ? override : new SystemClockAdapter();
  }

  private static LocalDate clockDate() {
    return LocalDate.ofInstant(Instant.ofEpochMilli(clock().nowMillis()), ZoneId.systemDefault());
  }

  static void setClockForTesting(ClockPort clock) {
    clockOverride = clock;
  }

  static void clearClockForTesting() {
    clockOverride = null;
  }

  static void setDatabaseForTesting(DatabaseSettings settings) {
    databaseOverride = settings;
  }

  static void clearDatabaseForTesting() {
    databaseOverride = null;
  }

  /** Exit code plus the report produced by a successful run. */
  record Outcome(ExitCode exitCode, Optional<PlanReport> report) {
    static Outcome failed(ExitCode exitCode) {
      return new Outcome(exitCode, Optional.empty());
    }
  }

  /** A configuration file or environment setting could not be used. */
  static final class ConfigFileException extends Exception {
    private static final long serialVersionUID = 1L;

    ConfigFileException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
