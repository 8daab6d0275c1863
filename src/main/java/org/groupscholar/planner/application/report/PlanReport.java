package org.groupscholar.planner.application.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
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
import org.groupscholar.planner.domain.aggregate.PortfolioSummary;
import org.groupscholar.planner.domain.aggregate.TierStatusTable;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.RecordIssue;

/**
 * <strong>What:</strong> Everything one run produced, bundled for the output adapters.
 * <p><strong>Shape:</strong> Only lists, maps, records and scalars; no cycles, so adapters can serialize it
 * field by field.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied on construction.</p>
 *
 * @param metadata run facts and configuration snapshot
 * @param actions every scored record in global order
 * @param tierStatus status by tier
 * @param horizon upcoming due dates by bucket
 * @param forecast per-day volume
 * @param summary run totals
 * @param channelMix channel to count
 * @param flagFrequency high-impact flag to count
 * @param cohortHotspots most pressing cohorts
 * @param cadenceAdherence share kept within cadence
 * @param cadenceGuidance one line per tier
 * @param ownerLoads owner load summaries
 * @param ownerAlerts owners over an alert threshold
 * @param ownerHorizons owner horizon buckets
 * @param ownerCapacities owner demand against capacity
 * @param ownerQueues per-owner top actions
 * @param channelBatches per-channel top actions
 * @param escalations urgent high-risk actions
 * @param issues normalization issues
 * @since 0.1.0
 */
public record PlanReport(
    RunMetadata metadata,
    List<Action> actions,
    TierStatusTable tierStatus,
    HorizonBuckets horizon,
    ForecastSeries forecast,
    PortfolioSummary summary,
    Map<String, Integer> channelMix,
    Map<String, Integer> flagFrequency,
    List<CohortHotspot> cohortHotspots,
    CadenceAdherence cadenceAdherence,
    List<String> cadenceGuidance,
    List<OwnerLoadSummary> ownerLoads,
    List<OwnerAlert> ownerAlerts,
    List<OwnerHorizon> ownerHorizons,
    List<OwnerCapacity> ownerCapacities,
    List<OwnerQueue> ownerQueues,
    List<ChannelBatch> channelBatches,
    List<Action> escalations,
    List<RecordIssue> issues) {

  public PlanReport {
    Objects.requireNonNull(metadata, "metadata");
    actions = List.copyOf(actions);
    Objects.requireNonNull(tierStatus, "tierStatus");
    Objects.requireNonNull(horizon, "horizon");
    Objects.requireNonNull(forecast, "forecast");
    Objects.requireNonNull(summary, "summary");
    channelMix = Collections.unmodifiableMap(new LinkedHashMap<>(channelMix));
    flagFrequency = Collections.unmodifiableMap(new LinkedHashMap<>(flagFrequency));
    cohortHotspots = List.copyOf(cohortHotspots);
    Objects.requireNonNull(cadenceAdherence, "cadenceAdherence");
    cadenceGuidance = List.copyOf(cadenceGuidance);
    ownerLoads = List.copyOf(ownerLoads);
    ownerAlerts = List.copyOf(ownerAlerts);
    ownerHorizons = List.copyOf(ownerHorizons);
    ownerCapacities = List.copyOf(ownerCapacities);
    ownerQueues = List.copyOf(ownerQueues);
    channelBatches = List.copyOf(channelBatches);
    escalations = List.copyOf(escalations);
    issues = List.copyOf(issues);
  }

  /**
   * Returns the first {@code limit} actions.
   *
   * @param limit maximum actions
   * @return leading actions in global order
   */
  public List<Action> topActions(int limit) {
    return actions.subList(0, Math.max(0, Math.min(limit, actions.size())));
  }
}
