package org.groupscholar.planner.application.pipeline;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.groupscholar.planner.application.normalize.HeaderAliases;
import org.groupscholar.planner.application.normalize.NormalizationResult;
import org.groupscholar.planner.application.normalize.RecordNormalizer;
import org.groupscholar.planner.application.port.ClockPort;
import org.groupscholar.planner.application.port.MetricsPort;
import org.groupscholar.planner.application.port.RecordSourcePort;
import org.groupscholar.planner.application.port.ReportOutputPort;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.record.RawRecord;
import org.groupscholar.planner.domain.record.RecordIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads records from a source, plans them and delivers the report to every output.
 * <p><strong>Why:</strong> Keeps I/O, time and metrics at the edge so {@link PlannerEngine} stays pure.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve {@code today} from the caller or the clock.</li>
 *   <li>Log rejected rows and record run metrics.</li>
 *   <li>Write the report to each output in order and close all of them, even after a failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@link #run(PlannerConfig, Optional)}
 * invocations; outputs are closed at the end of a run.</p>
 * <p><strong>Observability:</strong> Counters {@code planner.records.read}, {@code planner.records.scored},
 * {@code planner.records.rejected}, {@code planner.escalations}; histogram {@code planner.run.latencyMillis}.
 * The source label is placed in the MDC under {@code source} for the duration of the run.</p>
 *
 * @since 0.1.0
 */
public final class PlanUseCase {
  private static final Logger log = LoggerFactory.getLogger(PlanUseCase.class);
  private static final String MDC_SOURCE = "source";

  private final RecordSourcePort source;
  private final List<ReportOutputPort> outputs;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ZoneId zone;
  private final PlannerEngine engine;

  /**
   * Creates a use case with the system default time zone and standard aliases.
   *
   * @param source record source
   * @param outputs report outputs, written in order
   * @param metrics metrics sink
   * @param clock wall clock
   */
  public PlanUseCase(
      RecordSourcePort source, List<ReportOutputPort> outputs, MetricsPort metrics, ClockPort clock) {
    this(source, outputs, metrics, clock, ZoneId.systemDefault(), new PlannerEngine());
  }

  /**
   * Creates a fully specified use case.
   *
   * @param source record source
   * @param outputs report outputs, written in order
   * @param metrics metrics sink
   * @param clock wall clock
   * @param zone zone used to derive {@code today} from the clock
   * @param engine planning engine
   */
  public PlanUseCase(
      RecordSourcePort source,
      List<ReportOutputPort> outputs,
      MetricsPort metrics,
      ClockPort clock,
      ZoneId zone,
      PlannerEngine engine) {
    this.source = Objects.requireNonNull(source, "source");
    this.outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  /**
   * Runs one planning pass.
   *
   * @param config validated configuration
   * @param today evaluation date; the clock's current date when empty
   * @return the assembled report, already delivered to every output
   * @throws java.io.IOException if the source cannot be read or an output fails with an I/O error
   * @throws Exception if an output fails; close failures after an earlier failure are suppressed onto it
   */
  public PlanReport run(PlannerConfig config, Optional<LocalDate> today) throws Exception {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(today, "today");
    String previousSource = MDC.get(MDC_SOURCE);
    MDC.put(MDC_SOURCE, source.describe());
    try {
      long startMillis = clock.nowMillis();
      Instant generatedAt = Instant.ofEpochMilli(startMillis);
      LocalDate runDate = today.orElseGet(() -> LocalDate.ofInstant(generatedAt, zone));

      List<RawRecord> rows = source.readAll();
      metrics.add("planner.records.read", rows.size());
      log.info("Read {} rows from {}", rows.size(), source.describe());

      NormalizationResult normalized =
          new RecordNormalizer(HeaderAliases.standard(), config.invalidDatePolicy()).normalize(rows);
      logIssues(normalized.issues());

      PlanReport report = engine.plan(normalized, source.describe(), config, runDate, generatedAt);
      metrics.add("planner.records.scored", report.actions().size());
      metrics.add("planner.records.rejected", normalized.rejectedRows());
      metrics.add("planner.escalations", report.escalations().size());
      log.info("Planned {} records for {} ({} rejected, {} escalations, {} owner alerts)",
          report.actions().size(), runDate, normalized.rejectedRows(),
          report.escalations().size(), report.ownerAlerts().size());

      deliver(report);
      metrics.observe("planner.run.latencyMillis", Math.max(0L, clock.nowMillis() - startMillis));
      return report;
    } finally {
      if (previousSource == null) {
        MDC.remove(MDC_SOURCE);
      } else {
        MDC.put(MDC_SOURCE, previousSource);
      }
    }
  }

  private void deliver(PlanReport report) throws Exception {
    Exception failure = null;
    for (ReportOutputPort output : outputs) {
      if (failure != null) {
        break;
      }
      try {
        output.write(report);
      } catch (Exception ex) {
        failure = ex;
        log.error("Report output {} failed", output.getClass().getSimpleName(), ex);
      }
    }
    for (ReportOutputPort output : outputs) {
      try {
        output.close();
      } catch (Exception closeEx) {
        if (failure != null) {
          failure.addSuppressed(closeEx);
          log.error("Report output {} close failure (suppressed)", output.getClass().getSimpleName(), closeEx);
        } else {
          log.error("Report output {} close failure", output.getClass().getSimpleName(), closeEx);
          failure = closeEx;
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private static void logIssues(List<RecordIssue> issues) {
    for (RecordIssue issue : issues) {
      if (issue.excluded()) {
        log.warn("Row {} rejected ({}): {}", issue.rowNumber(), issue.kind(), issue.message());
      } else {
        log.info("Row {} accepted with issue ({}): {}", issue.rowNumber(), issue.kind(), issue.message());
      }
    }
  }
}
