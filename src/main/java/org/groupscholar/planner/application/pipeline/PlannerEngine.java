package org.groupscholar.planner.application.pipeline;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.groupscholar.planner.application.aggregate.ChannelBatchPlanner;
import org.groupscholar.planner.application.aggregate.EscalationSelector;
import org.groupscholar.planner.application.aggregate.HorizonForecastBucketer;
import org.groupscholar.planner.application.aggregate.OwnerWorkloadAnalyzer;
import org.groupscholar.planner.application.aggregate.PortfolioSummarizer;
import org.groupscholar.planner.application.aggregate.TierStatusAggregator;
import org.groupscholar.planner.application.normalize.HeaderAliases;
import org.groupscholar.planner.application.normalize.NormalizationResult;
import org.groupscholar.planner.application.normalize.RecordNormalizer;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.application.report.ReportAssembler;
import org.groupscholar.planner.application.report.RunMetadata;
import org.groupscholar.planner.application.scoring.ActionOrder;
import org.groupscholar.planner.application.scoring.PriorityScorer;
import org.groupscholar.planner.application.scoring.TouchpointClassifier;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.aggregate.OwnerLoadSummary;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.RawRecord;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the planning stages over one batch of rows and returns the assembled report.
 * <p><strong>Stages:</strong> normalize, classify, score, rank, then aggregate (tier/status, horizon and forecast,
 * owner workload, channel batches, escalations, portfolio summaries) and assemble.</p>
 * <p><strong>Purity:</strong> No I/O and no clock access; {@code today} and {@code generatedAt} are parameters,
 * so the same inputs always give an equal report.</p>
 * <p><strong>Thread-safety:</strong> Stateless; stage objects are created per run from the supplied config.</p>
 *
 * @since 0.1.0
 */
public final class PlannerEngine {
  private static final Logger log = LoggerFactory.getLogger(PlannerEngine.class);

  private final HeaderAliases aliases;

  /** Creates an engine with the standard header aliases. */
  public PlannerEngine() {
    this(HeaderAliases.standard());
  }

  /**
   * Creates an engine with a custom alias table.
   *
   * @param aliases header alias table
   */
  public PlannerEngine(HeaderAliases aliases) {
    this.aliases = Objects.requireNonNull(aliases, "aliases");
  }

  /**
   * Normalizes and plans raw rows.
   *
   * @param rows raw rows in source order
   * @param source source description recorded in the metadata
   * @param config validated configuration
   * @param today evaluation date
   * @param generatedAt report timestamp
   * @return assembled report
   */
  public PlanReport run(
      List<RawRecord> rows, String source, PlannerConfig config, LocalDate today, Instant generatedAt) {
    Objects.requireNonNull(config, "config");
    NormalizationResult normalized =
        new RecordNormalizer(aliases, config.invalidDatePolicy()).normalize(rows);
    return plan(normalized, source, config, today, generatedAt);
  }

  /**
   * Plans already-normalized records.
   *
   * @param normalized normalizer output
   * @param source source description recorded in the metadata
   * @param config validated configuration
   * @param today evaluation date
   * @param generatedAt report timestamp
   * @return assembled report
   * @throws org.groupscholar.planner.domain.aggregate.PlannerInvariantException if aggregates disagree
   */
  public PlanReport plan(
      NormalizationResult normalized,
      String source,
      PlannerConfig config,
      LocalDate today,
      Instant generatedAt) {
    Objects.requireNonNull(normalized, "normalized");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(today, "today");
    Objects.requireNonNull(generatedAt, "generatedAt");

    TouchpointClassifier classifier = new TouchpointClassifier(config);
    PriorityScorer scorer = new PriorityScorer(config);
    List<ScoredRecord> scored = new ArrayList<>(normalized.records().size());
    for (NormalizedRecord record : normalized.records()) {
      scored.add(scorer.score(record, classifier.classify(record, today)));
    }
    List<Action> actions = ActionOrder.rank(scored);
    log.debug("Scored and ranked {} records", actions.size());

    HorizonForecastBucketer bucketer = new HorizonForecastBucketer();
    OwnerWorkloadAnalyzer owners = new OwnerWorkloadAnalyzer(config);
    PortfolioSummarizer portfolio = new PortfolioSummarizer(config);
    List<OwnerLoadSummary> loads = owners.loads(scored);

    RunMetadata metadata = new RunMetadata(
        source, today, generatedAt, config.toMap(),
        normalized.rowsRead(), scored.size(), normalized.rejectedRows());

    return ReportAssembler.forRun(metadata)
        .actions(actions)
        .tierStatus(new TierStatusAggregator().aggregate(scored))
        .horizon(bucketer.horizon(scored))
        .forecast(bucketer.forecast(
            scored, today, config.forecastWindowDays(), config.forecastIncludeOverdue()))
        .summary(portfolio.summary(scored, normalized.rejectedRows()))
        .channelMix(portfolio.channelMix(scored))
        .flagFrequency(portfolio.flagFrequency(scored))
        .cohortHotspots(portfolio.cohortHotspots(scored))
        .cadenceAdherence(portfolio.cadenceAdherence(scored))
        .cadenceGuidance(portfolio.cadenceGuidance())
        .ownerLoads(loads)
        .ownerAlerts(owners.alerts(loads))
        .ownerHorizons(owners.horizons(scored))
        .ownerCapacities(owners.capacities(scored))
        .ownerQueues(owners.queues(actions))
        .channelBatches(new ChannelBatchPlanner(config).plan(actions))
        .escalations(new EscalationSelector(config).select(actions))
        .issues(normalized.issues())
        .assemble();
  }
}
