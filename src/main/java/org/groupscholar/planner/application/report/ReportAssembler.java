package org.groupscholar.planner.application.report;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.groupscholar.planner.domain.aggregate.CadenceAdherence;
import org.groupscholar.planner.domain.aggregate.ChannelBatch;
import org.groupscholar.planner.domain.aggregate.CohortHotspot;
import org.groupscholar.planner.domain.aggregate.ForecastSeries;
import org.groupscholar.planner.domain.aggregate.HorizonBuckets;
import org.groupscholar.planner.domain.aggregate.OwnerAlert;
import org.groupscholar.planner.domain.aggregate.OwnerCapacity;
import org.groupscholar.planner.domain.aggregate.OwnerHorizon;
import org.groupscholar.planner.domain.aggregate.OwnerLoadSummary;
import org.groupscholar.planner.domain.aggregate.OwnerQueue;
import org.groupscholar.planner.domain.aggregate.PlannerInvariantException;
import org.groupscholar.planner.domain.aggregate.PortfolioSummary;
import org.groupscholar.planner.domain.aggregate.TierStatusTable;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.RecordIssue;

/**
 * <strong>What:</strong> Collects stage outputs and builds a {@link PlanReport}.
 * <p><strong>Checks:</strong> Before the report is built, every aggregate that partitions the scored records is
 * compared with the action count; a mismatch raises {@link PlannerInvariantException} rather than producing a
 * report whose sections disagree.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; use one assembler per run.</p>
 *
 * @since 0.1.0
 */
public final class ReportAssembler {
  private final RunMetadata metadata;
  private List<Action> actions = List.of();
  private TierStatusTable tierStatus;
  private HorizonBuckets horizon;
  private ForecastSeries forecast;
  private PortfolioSummary summary;
  private Map<String, Integer> channelMix = Map.of();
  private Map<String, Integer> flagFrequency = Map.of();
  private List<CohortHotspot> cohortHotspots = List.of();
  private CadenceAdherence cadenceAdherence;
  private List<String> cadenceGuidance = List.of();
  private List<OwnerLoadSummary> ownerLoads = List.of();
  private List<OwnerAlert> ownerAlerts = List.of();
  private List<OwnerHorizon> ownerHorizons = List.of();
  private List<OwnerCapacity> ownerCapacities = List.of();
  private List<OwnerQueue> ownerQueues = List.of();
  private List<ChannelBatch> channelBatches = List.of();
  private List<Action> escalations = List.of();
  private List<RecordIssue> issues = List.of();

  private ReportAssembler(RunMetadata metadata) {
    this.metadata = Objects.requireNonNull(metadata, "metadata");
  }

  /**
   * Starts assembling a report for one run.
   *
   * @param metadata run facts
   * @return new assembler
   */
  public static ReportAssembler forRun(RunMetadata metadata) {
    return new ReportAssembler(metadata);
  }

  public ReportAssembler actions(List<Action> value) {
    this.actions = Objects.requireNonNull(value, "actions");
    return this;
  }

  public ReportAssembler tierStatus(TierStatusTable value) {
    this.tierStatus = value;
    return this;
  }

  public ReportAssembler horizon(HorizonBuckets value) {
    this.horizon = value;
    return this;
  }

  public ReportAssembler forecast(ForecastSeries value) {
    this.forecast = value;
    return this;
  }

  public ReportAssembler summary(PortfolioSummary value) {
    this.summary = value;
    return this;
  }

  public ReportAssembler channelMix(Map<String, Integer> value) {
    this.channelMix = Objects.requireNonNull(value, "channelMix");
    return this;
  }

  public ReportAssembler flagFrequency(Map<String, Integer> value) {
    this.flagFrequency = Objects.requireNonNull(value, "flagFrequency");
    return this;
  }

  public ReportAssembler cohortHotspots(List<CohortHotspot> value) {
    this.cohortHotspots = Objects.requireNonNull(value, "cohortHotspots");
    return this;
  }

  public ReportAssembler cadenceAdherence(CadenceAdherence value) {
    this.cadenceAdherence = value;
    return this;
  }

  public ReportAssembler cadenceGuidance(List<String> value) {
    this.cadenceGuidance = Objects.requireNonNull(value, "cadenceGuidance");
    return this;
  }

  public ReportAssembler ownerLoads(List<OwnerLoadSummary> value) {
    this.ownerLoads = Objects.requireNonNull(value, "ownerLoads");
    return this;
  }

  public ReportAssembler ownerAlerts(List<OwnerAlert> value) {
    this.ownerAlerts = Objects.requireNonNull(value, "ownerAlerts");
    return this;
  }

  public ReportAssembler ownerHorizons(List<OwnerHorizon> value) {
    this.ownerHorizons = Objects.requireNonNull(value, "ownerHorizons");
    return this;
  }

  public ReportAssembler ownerCapacities(List<OwnerCapacity> value) {
    this.ownerCapacities = Objects.requireNonNull(value, "ownerCapacities");
    return this;
  }

  public ReportAssembler ownerQueues(List<OwnerQueue> value) {
    this.ownerQueues = Objects.requireNonNull(value, "ownerQueues");
    return this;
  }

  public ReportAssembler channelBatches(List<ChannelBatch> value) {
    this.channelBatches = Objects.requireNonNull(value, "channelBatches");
    return this;
  }

  public ReportAssembler escalations(List<Action> value) {
    this.escalations = Objects.requireNonNull(value, "escalations");
    return this;
  }

  public ReportAssembler issues(List<RecordIssue> value) {
    this.issues = Objects.requireNonNull(value, "issues");
    return this;
  }

  /**
   * Cross-checks the collected sections and builds the report.
   *
   * @return immutable report
   * @throws NullPointerException if a required section was never supplied
   * @throws PlannerInvariantException if sections disagree on record counts
   */
  public PlanReport assemble() {
    Objects.requireNonNull(tierStatus, "tierStatus");
    Objects.requireNonNull(horizon, "horizon");
    Objects.requireNonNull(forecast, "forecast");
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(cadenceAdherence, "cadenceAdherence");

    int scored = actions.size();
    PlannerInvariantException.requireEqual("scored records", metadata.scoredCount(), scored);
    PlannerInvariantException.requireEqual(
        "rows read", metadata.rowsRead(), (long) metadata.scoredCount() + metadata.rejectedCount());
    PlannerInvariantException.requireEqual("tier/status table total", scored, tierStatus.total());
    PlannerInvariantException.requireEqual("horizon total", scored, horizon.total());
    PlannerInvariantException.requireEqual("forecast partition",
        scored, (long) forecast.inWindow() + forecast.overdue() + forecast.beyondWindow() + forecast.noDueDate());
    PlannerInvariantException.requireEqual("summary total", scored, summary.total());
    PlannerInvariantException.requireEqual("summary rejected", metadata.rejectedCount(), summary.rejected());
    PlannerInvariantException.requireEqual("adherence total", scored, cadenceAdherence.overall().total());
    for (int i = 0; i < scored; i++) {
      PlannerInvariantException.requireEqual("action rank", i + 1L, actions.get(i).rank());
    }
    Set<String> ids = new HashSet<>();
    for (Action action : actions) {
      ids.add(action.id());
    }
    for (Action escalation : escalations) {
      if (!ids.contains(escalation.id())) {
        throw new PlannerInvariantException("escalation " + escalation.id() + " is not a ranked action");
      }
    }

    return new PlanReport(
        metadata, actions, tierStatus, horizon, forecast, summary, channelMix, flagFrequency, cohortHotspots,
        cadenceAdherence, cadenceGuidance, ownerLoads, ownerAlerts, ownerHorizons, ownerCapacities, ownerQueues,
        channelBatches, escalations, issues);
  }
}
