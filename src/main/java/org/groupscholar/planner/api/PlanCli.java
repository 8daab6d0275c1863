package org.groupscholar.planner.api;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.groupscholar.planner.api.PlannerCliSupport.ConfigFileException;
import org.groupscholar.planner.api.PlannerCliSupport.RunSettings;
import org.groupscholar.planner.application.port.ReportOutputPort;
import org.groupscholar.planner.config.DatabaseSettings;
import org.groupscholar.planner.config.DefaultsForMode;
import org.groupscholar.planner.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code planner plan}: score an outreach CSV, print the action plan and optionally write JSON or persist the run.
 *
 * @since 0.1.0
 */
public final class PlanCli {
  private static final Logger log = LoggerFactory.getLogger(PlanCli.class);
  private static final String SUMMARY_USAGE =
      "usage: plan in=PATH [json=PATH] [config=PATH] [today=YYYY-MM-DD] [key=value ...] "
          + "[--explain] [--persist] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      Intervention planner: plan

      Usage:
        plan in=PATH [options]

      Input and output:
        in=PATH                   Outreach CSV with a header row (required)
        json=PATH                 Also write the full report as JSON
        config=PATH               YAML file with common/plan sections
        today=YYYY-MM-DD          Evaluate as of this date (default: system date)

      Scoring:
        highRisk=70 mediumRisk=40 Risk tier thresholds (0-100, medium < high)
        soonDays=14               Days ahead counted as due soon
        staleDays=60 staleBoost=15
        cadence.high=7 cadence.medium=21 cadence.low=45
        highImpactFlags=a,b,c     Flags that add flagWeight points each
        invalidDatePolicy=NEVER_TOUCHED|REJECT

      Lists and views:
        limit=10 cohortLimit=5 ownerLimit=5 ownerQueueLimit=5 ownerQueueSize=3
        channelBatchPool=20 channelBatchLimit=4 channelBatchSize=3
        escalationLimit=5 escalationMinScore=90
        alertOverdue=2 alertNoTouch=1 alertTotal=8
        forecastWindowDays=21 forecastIncludeOverdue=false
        capacityWindowDays=7 dailyCapacity=3 capacityIncludeOverdue=true

      Run store (with --persist; credentials from GS_DB_DSN or GS_DB_HOST/PORT/NAME/USER/PASSWORD):
        dbSchema=intervention_planner runLabel=LABEL

      Metrics:
        metricsExporter=otlp|none otelEndpoint=URL otelResourceAttributes=k=v,...

      Flags:
        --explain   Print the reasons behind each score
        --persist   Store the run in the database
        --dry-run   Validate settings and print them without reading input
        --verbose   Enable DEBUG logging
        --help      Show this message
      """;

  private static final Set<String> EXTRA_KEYS = Set.of("in", "json", "config", "today", "runLabel");

  private PlanCli() {}

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
      log.debug("Verbose logging enabled for plan");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      rejectUnknownKeys(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--explain")) {
      kv.put("explain", "true");
    }
    if (input.hasFlag("--persist")) {
      kv.put("persist", "true");
    }
    if (input.hasFlag("--dry-run")) {
      kv.put("dryRun", "true");
    }

    Map<String, String> effective;
    RunSettings settings;
    boolean dryRun;
    try {
      effective = PlannerCliSupport.effectiveSettings("plan", kv);
      dryRun = ConfigCliUtils.parseBoolean(effective, "dryRun");
      settings = PlannerCliSupport.resolve(effective, !dryRun);
    } catch (ConfigFileException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid plan configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(settings);
      return ExitCode.SUCCESS;
    }

    Optional<DatabaseSettings> database = Optional.empty();
    if (settings.persist()) {
      try {
        database = Optional.of(PlannerCliSupport.databaseSettings());
      } catch (ConfigFileException ex) {
        log.error("Configuration error: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
    }

    List<ReportOutputPort> outputs = PlannerCliSupport.outputs(settings, true, database);
    log.info("Planning {} as of {}", settings.input(), settings.today());
    ExitCode exit = PlannerCliSupport.execute(settings, outputs).exitCode();
    if (exit == ExitCode.SUCCESS) {
      settings.json().ifPresent(path -> {
        CliPrinter.blankLine();
        CliPrinter.println("JSON report written to " + path);
      });
    }
    return exit;
  }

  private static void rejectUnknownKeys(Map<String, String> kv) {
    Set<String> known = new HashSet<>(DefaultsForMode.asFlatMap("plan").keySet());
    known.addAll(EXTRA_KEYS);
    for (String key : kv.keySet()) {
      if (!known.contains(key)) {
        throw new IllegalArgumentException("unknown option: " + key);
      }
    }
  }

  private static void printDryRunPlan(RunSettings settings) {
    CliPrinter.println("Plan dry-run: no input will be read and nothing will be written.");
    CliPrinter.printSetting("in", settings.input());
    CliPrinter.printSetting("json", settings.json().orElse(null));
    CliPrinter.printSetting("today", settings.today());
    CliPrinter.printSetting("persist", settings.persist()
        ? "true (schema " + settings.dbSchema() + ", label " + settings.runLabel() + ")"
        : "false");
    CliPrinter.printSetting("metricsExporter", settings.otlp() ? "otlp" : "none");
    settings.config().toMap().forEach(CliPrinter::printSetting);
    CliPrinter.println(" Re-run without --dry-run to produce the plan.");
  }
}
