package org.groupscholar.planner.application.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.groupscholar.planner.application.scoring.PriorityScorer;
import org.groupscholar.planner.config.CadencePolicy;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.aggregate.CadenceAdherence;
import org.groupscholar.planner.domain.aggregate.CohortHotspot;
import org.groupscholar.planner.domain.aggregate.PortfolioSummary;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * <strong>What:</strong> Run-wide summaries: totals, channel mix, high-impact flag frequency, cohort hotspots,
 * cadence adherence and cadence guidance.
 * <p><strong>Ordering:</strong> Count maps are ordered by count descending then key, so output is reproducible
 * regardless of input order.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class PortfolioSummarizer {
  private static final Comparator<CohortHotspot> HOTSPOT_ORDER =
      Comparator.comparingInt(CohortHotspot::overdue).reversed()
          .thenComparing(Comparator.comparingInt(CohortHotspot::dueSoon).reversed())
          .thenComparing(Comparator.comparingDouble(CohortHotspot::avgPriority).reversed())
          .thenComparing(CohortHotspot::cohort);

  private final Set<String> highImpactFlags;
  private final int cohortLimit;
  private final CadencePolicy cadence;

  /**
   * Creates a summarizer from the run configuration.
   *
   * @param config validated planner configuration
   */
  public PortfolioSummarizer(PlannerConfig config) {
    Objects.requireNonNull(config, "config");
    this.highImpactFlags = config.highImpactFlags();
    this.cohortLimit = config.cohortLimit();
    this.cadence = config.cadence();
  }

  /**
   * Totals by status and tier plus data-quality counters.
   *
   * @param scored scored records
   * @param rejectedRows rows excluded by normalization
   * @return portfolio summary
   */
  public PortfolioSummary summary(List<ScoredRecord> scored, int rejectedRows) {
    Objects.requireNonNull(scored, "scored");
    Map<TouchStatus, Integer> byStatus = new EnumMap<>(TouchStatus.class);
    Map<RiskTier, Integer> byTier = new EnumMap<>(RiskTier.class);
    Map<RiskTier, Integer> staleByTier = new EnumMap<>(RiskTier.class);
    int stale = 0;
    int future = 0;
    for (ScoredRecord record : scored) {
      byStatus.merge(record.status(), 1, Integer::sum);
      byTier.merge(record.tier(), 1, Integer::sum);
      if (record.stale()) {
        stale++;
        staleByTier.merge(record.tier(), 1, Integer::sum);
      }
      if (record.assessment().futureTouchDate()) {
        future++;
      }
    }
    return new PortfolioSummary(scored.size(), byStatus, byTier, stale, staleByTier, future, rejectedRows);
  }

  /**
   * Counts records per canonical channel.
   *
   * @param scored scored records
   * @return channel to count, largest first
   */
  public Map<String, Integer> channelMix(List<ScoredRecord> scored) {
    Map<String, Integer> counts = new HashMap<>();
    for (ScoredRecord record : scored) {
      counts.merge(record.record().channelPreference(), 1, Integer::sum);
    }
    return orderByCount(counts);
  }

  /**
   * Counts high-impact flags across records.
   *
   * @param scored scored records
   * @return flag to count, largest first; flags outside the high-impact set are ignored
   */
  public Map<String, Integer> flagFrequency(List<ScoredRecord> scored) {
    Map<String, Integer> counts = new HashMap<>();
    for (ScoredRecord record : scored) {
      for (String flag : record.record().flags()) {
        if (highImpactFlags.contains(flag)) {
          counts.merge(flag, 1, Integer::sum);
        }
      }
    }
    return orderByCount(counts);
  }

  /**
   * Summarizes cohorts and keeps the most pressing ones.
   *
   * @param scored scored records
   * @return at most {@code cohortLimit} hotspots, most overdue first
   */
  public List<CohortHotspot> cohortHotspots(List<ScoredRecord> scored) {
    Map<String, List<ScoredRecord>> grouped = new TreeMap<>();
    for (ScoredRecord record : scored) {
      grouped.computeIfAbsent(record.record().cohortOrUnassigned(), key -> new ArrayList<>()).add(record);
    }
    List<CohortHotspot> hotspots = new ArrayList<>();
    grouped.forEach((cohort, records) -> {
      int[] status = new int[TouchStatus.values().length];
      int[] tiers = new int[RiskTier.values().length];
      for (ScoredRecord record : records) {
        status[record.status().ordinal()]++;
        tiers[record.tier().ordinal()]++;
      }
      hotspots.add(new CohortHotspot(
          cohort,
          records.size(),
          status[TouchStatus.OVERDUE.ordinal()],
          status[TouchStatus.DUE_SOON.ordinal()],
          status[TouchStatus.NO_TOUCH.ordinal()],
          tiers[RiskTier.HIGH.ordinal()],
          tiers[RiskTier.MEDIUM.ordinal()],
          tiers[RiskTier.LOW.ordinal()],
          OwnerWorkloadAnalyzer.averagePriority(records)));
    });
    hotspots.sort(HOTSPOT_ORDER);
    return List.copyOf(hotspots.subList(0, Math.min(cohortLimit, hotspots.size())));
  }

  /**
   * Measures how many records are kept within cadence, per tier and overall.
   *
   * @param scored scored records
   * @return adherence rows
   */
  public CadenceAdherence cadenceAdherence(List<ScoredRecord> scored) {
    Map<RiskTier, List<ScoredRecord>> byTier = new EnumMap<>(RiskTier.class);
    for (ScoredRecord record : scored) {
      byTier.computeIfAbsent(record.tier(), key -> new ArrayList<>()).add(record);
    }
    Map<RiskTier, CadenceAdherence.Row> rows = new EnumMap<>(RiskTier.class);
    for (RiskTier tier : RiskTier.values()) {
      rows.put(tier, adherenceRow(byTier.getOrDefault(tier, List.of())));
    }
    return new CadenceAdherence(rows, adherenceRow(scored));
  }

  /**
   * Returns one guidance line per tier, such as {@code "High risk: touch every 7 days"}.
   *
   * @return guidance lines in tier order
   */
  public List<String> cadenceGuidance() {
    List<String> lines = new ArrayList<>();
    for (RiskTier tier : RiskTier.values()) {
      lines.add(tier.displayName() + " risk: touch every " + cadence.cadenceDays(tier) + " days");
    }
    return List.copyOf(lines);
  }

  private static CadenceAdherence.Row adherenceRow(List<ScoredRecord> records) {
    int compliant = 0;
    int overdue = 0;
    int noTouch = 0;
    for (ScoredRecord record : records) {
      if (record.status().compliant()) {
        compliant++;
      } else if (record.status() == TouchStatus.OVERDUE) {
        overdue++;
      } else if (record.status() == TouchStatus.NO_TOUCH) {
        noTouch++;
      }
    }
    double rate = records.isEmpty() ? 0.0 : PriorityScorer.round2((double) compliant / records.size());
    return new CadenceAdherence.Row(records.size(), compliant, overdue, noTouch, rate);
  }

  private static Map<String, Integer> orderByCount(Map<String, Integer> counts) {
    List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed()
        .thenComparing(Map.Entry.<String, Integer>comparingByKey()));
    Map<String, Integer> ordered = new LinkedHashMap<>();
    for (Map.Entry<String, Integer> entry : entries) {
      ordered.put(entry.getKey(), entry.getValue());
    }
    return Collections.unmodifiableMap(ordered);
  }
}
