package org.groupscholar.planner.application.aggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToIntFunction;
import org.groupscholar.planner.application.scoring.PriorityScorer;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.aggregate.AlertReason;
import org.groupscholar.planner.domain.aggregate.HorizonBucket;
import org.groupscholar.planner.domain.aggregate.OwnerAlert;
import org.groupscholar.planner.domain.aggregate.OwnerCapacity;
import org.groupscholar.planner.domain.aggregate.OwnerHorizon;
import org.groupscholar.planner.domain.aggregate.OwnerLoadSummary;
import org.groupscholar.planner.domain.aggregate.OwnerQueue;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * <strong>What:</strong> Per-owner workload views: load summary, alerts, horizon, capacity and action queues.
 * <p><strong>Grouping:</strong> Records without an owner are grouped under {@code Unassigned}.</p>
 * <p><strong>Alerts:</strong> An ordered rule table of (condition, threshold); an owner's alert carries every
 * condition that fired, not just the first.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class OwnerWorkloadAnalyzer {
  private static final Comparator<OwnerLoadSummary> LOAD_ORDER =
      Comparator.comparingInt(OwnerLoadSummary::overdue).reversed()
          .thenComparing(Comparator.comparingInt(OwnerLoadSummary::noTouch).reversed())
          .thenComparing(Comparator.comparingInt(OwnerLoadSummary::total).reversed())
          .thenComparing(OwnerLoadSummary::owner);

  private static final Comparator<OwnerHorizon> HORIZON_ORDER =
      Comparator.comparingInt((OwnerHorizon horizon) -> horizon.buckets().overdue()).reversed()
          .thenComparing(Comparator.comparingInt(
              (OwnerHorizon horizon) -> horizon.buckets().count(HorizonBucket.NEXT_7_DAYS)).reversed())
          .thenComparing(Comparator.comparingInt(OwnerHorizon::total).reversed())
          .thenComparing(OwnerHorizon::owner);

  private static final Comparator<OwnerCapacity> CAPACITY_ORDER =
      Comparator.comparingDouble(OwnerCapacity::utilization).reversed()
          .thenComparing(Comparator.comparingInt(OwnerCapacity::gap).reversed())
          .thenComparing(OwnerCapacity::owner);

  private final List<AlertRule> alertRules;
  private final int capacityWindowDays;
  private final int dailyCapacity;
  private final boolean capacityIncludeOverdue;
  private final int ownerQueueLimit;
  private final int ownerQueueSize;
  private final HorizonForecastBucketer bucketer = new HorizonForecastBucketer();

  /**
   * Creates an analyzer from the run configuration.
   *
   * @param config validated planner configuration
   */
  public OwnerWorkloadAnalyzer(PlannerConfig config) {
    Objects.requireNonNull(config, "config");
    this.alertRules = List.of(
        new AlertRule(AlertReason.OVERDUE, OwnerLoadSummary::overdue, config.alertOverdue()),
        new AlertRule(AlertReason.NO_TOUCH, OwnerLoadSummary::noTouch, config.alertNoTouch()),
        new AlertRule(AlertReason.TOTAL, OwnerLoadSummary::total, config.alertTotal()));
    this.capacityWindowDays = config.capacityWindowDays();
    this.dailyCapacity = config.dailyCapacity();
    this.capacityIncludeOverdue = config.capacityIncludeOverdue();
    this.ownerQueueLimit = config.ownerQueueLimit();
    this.ownerQueueSize = config.ownerQueueSize();
  }

  /**
   * Summarizes every owner's load.
   *
   * @param scored scored records
   * @return one summary per owner, most overdue first
   */
  public List<OwnerLoadSummary> loads(List<ScoredRecord> scored) {
    List<OwnerLoadSummary> loads = new ArrayList<>();
    byOwner(scored).forEach((owner, records) -> {
      int overdue = 0;
      int dueSoon = 0;
      int onTrack = 0;
      int noTouch = 0;
      int stale = 0;
      int highRisk = 0;
      for (ScoredRecord record : records) {
        switch (record.status()) {
          case OVERDUE -> overdue++;
          case DUE_SOON -> dueSoon++;
          case ON_TRACK -> onTrack++;
          case NO_TOUCH -> noTouch++;
        }
        if (record.stale()) {
          stale++;
        }
        if (record.tier() == RiskTier.HIGH) {
          highRisk++;
        }
      }
      OwnerCapacity capacity = capacityOf(owner, records);
      loads.add(new OwnerLoadSummary(
          owner, records.size(), overdue, dueSoon, onTrack, noTouch, stale, highRisk,
          averagePriority(records), capacity.dueWithinWindow(), capacity.capacity(), capacity.gap(),
          capacity.utilization()));
    });
    loads.sort(LOAD_ORDER);
    return List.copyOf(loads);
  }

  /**
   * Evaluates the alert rules against owner loads.
   *
   * @param loads owner loads in load order
   * @return alerts for owners with at least one triggered condition, most reasons first, then load order
   */
  public List<OwnerAlert> alerts(List<OwnerLoadSummary> loads) {
    Objects.requireNonNull(loads, "loads");
    List<OwnerAlert> alerts = new ArrayList<>();
    for (OwnerLoadSummary load : loads) {
      Set<AlertReason> reasons = EnumSet.noneOf(AlertReason.class);
      for (AlertRule rule : alertRules) {
        if (rule.metric().applyAsInt(load) >= rule.threshold()) {
          reasons.add(rule.reason());
        }
      }
      if (!reasons.isEmpty()) {
        alerts.add(new OwnerAlert(load.owner(), reasons, load.overdue(), load.noTouch(), load.total()));
      }
    }
    // stable sort keeps load order within equal reason counts
    alerts.sort(Comparator.comparingInt((OwnerAlert alert) -> alert.reasons().size()).reversed());
    return List.copyOf(alerts);
  }

  /**
   * Buckets each owner's due dates.
   *
   * @param scored scored records
   * @return one horizon per owner, most overdue first
   */
  public List<OwnerHorizon> horizons(List<ScoredRecord> scored) {
    List<OwnerHorizon> horizons = new ArrayList<>();
    byOwner(scored).forEach((owner, records) ->
        horizons.add(new OwnerHorizon(owner, records.size(), bucketer.horizon(records), averagePriority(records))));
    horizons.sort(HORIZON_ORDER);
    return List.copyOf(horizons);
  }

  /**
   * Compares each owner's near-term demand with capacity.
   *
   * @param scored scored records
   * @return one row per owner, highest utilization first
   */
  public List<OwnerCapacity> capacities(List<ScoredRecord> scored) {
    List<OwnerCapacity> capacities = new ArrayList<>();
    byOwner(scored).forEach((owner, records) -> capacities.add(capacityOf(owner, records)));
    capacities.sort(CAPACITY_ORDER);
    return List.copyOf(capacities);
  }

  /**
   * Builds per-owner action queues.
   *
   * @param actions ranked actions in global order
   * @return queues ordered by each owner's best rank, at most {@code ownerQueueLimit} owners
   */
  public List<OwnerQueue> queues(List<Action> actions) {
    Objects.requireNonNull(actions, "actions");
    Map<String, List<Action>> grouped = new LinkedHashMap<>();
    for (Action action : actions) {
      grouped.computeIfAbsent(action.scored().owner(), key -> new ArrayList<>()).add(action);
    }
    List<OwnerQueue> queues = new ArrayList<>();
    for (Map.Entry<String, List<Action>> entry : grouped.entrySet()) {
      if (queues.size() >= ownerQueueLimit) {
        break;
      }
      List<Action> owned = entry.getValue();
      queues.add(new OwnerQueue(
          entry.getKey(), owned.size(), owned.subList(0, Math.min(ownerQueueSize, owned.size()))));
    }
    return List.copyOf(queues);
  }

  private OwnerCapacity capacityOf(String owner, List<ScoredRecord> records) {
    int due = 0;
    int overdue = 0;
    for (ScoredRecord record : records) {
      OptionalInt dueIn = record.dueInDays();
      if (dueIn.isEmpty()) {
        continue;
      }
      int days = dueIn.getAsInt();
      if (days < 0) {
        overdue++;
        if (capacityIncludeOverdue) {
          due++;
        }
      } else if (days < capacityWindowDays) {
        due++;
      }
    }
    int capacity = capacityWindowDays * dailyCapacity;
    int gap = Math.max(0, due - capacity);
    double utilization = PriorityScorer.round2((double) due / capacity);
    return new OwnerCapacity(owner, due, overdue, capacity, gap, utilization);
  }

  static double averagePriority(List<ScoredRecord> records) {
    if (records.isEmpty()) {
      return 0.0;
    }
    double sum = 0.0;
    for (ScoredRecord record : records) {
      sum += record.priorityScore();
    }
    return PriorityScorer.round2(sum / records.size());
  }

  private static Map<String, List<ScoredRecord>> byOwner(List<ScoredRecord> scored) {
    Objects.requireNonNull(scored, "scored");
    Map<String, List<ScoredRecord>> grouped = new TreeMap<>();
    for (ScoredRecord record : scored) {
      grouped.computeIfAbsent(record.owner(), key -> new ArrayList<>()).add(record);
    }
    return grouped;
  }

  private record AlertRule(AlertReason reason, ToIntFunction<OwnerLoadSummary> metric, int threshold) {}
}
