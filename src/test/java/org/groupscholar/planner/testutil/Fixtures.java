package org.groupscholar.planner.testutil;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import org.groupscholar.planner.application.pipeline.PlannerEngine;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.application.scoring.ActionOrder;
import org.groupscholar.planner.application.scoring.PriorityScorer;
import org.groupscholar.planner.application.scoring.TouchpointClassifier;
import org.groupscholar.planner.config.CadencePolicy;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.RawRecord;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchAssessment;
import org.groupscholar.planner.domain.record.TouchStatus;

/** Builders for records at each pipeline stage. */
public final class Fixtures {
  public static final LocalDate TODAY = LocalDate.of(2025, 1, 15);
  public static final LocalDate SAMPLE_TODAY = LocalDate.of(2024, 4, 1);
  public static final Instant SAMPLE_GENERATED = Instant.parse("2024-04-01T12:00:00Z");

  private Fixtures() {}

  public static NormalizedRecord record(
      String id, int risk, LocalDate lastTouch, String owner, String channel, String... flags) {
    return new NormalizedRecord(
        1,
        id,
        "Scholar " + id,
        "Cohort A",
        Optional.ofNullable(owner),
        channel,
        Optional.ofNullable(lastTouch),
        risk,
        Set.of(flags));
  }

  /** Classifies and scores a record the way the engine does. */
  public static ScoredRecord scored(PlannerConfig config, NormalizedRecord record, LocalDate today) {
    TouchAssessment assessment = new TouchpointClassifier(config).classify(record, today);
    return new PriorityScorer(config).score(record, assessment);
  }

  /**
   * Builds a scored record with a chosen due offset, bypassing the classifier.
   *
   * @param dueIn days until due relative to {@link #TODAY}; {@code null} for never touched
   */
  public static ScoredRecord withDueIn(String id, String owner, Integer dueIn, double score) {
    return assessed(id, owner, 50, dueIn, score);
  }

  public static ScoredRecord assessed(String id, String owner, int risk, Integer dueIn, double score) {
    RiskTier tier = risk >= 70 ? RiskTier.HIGH : risk >= 40 ? RiskTier.MEDIUM : RiskTier.LOW;
    int cadence = CadencePolicy.STANDARD.cadenceDays(tier);
    TouchStatus status;
    OptionalInt since = OptionalInt.empty();
    OptionalInt due = OptionalInt.empty();
    Optional<LocalDate> next = Optional.empty();
    Optional<LocalDate> lastTouch = Optional.empty();
    if (dueIn == null) {
      status = TouchStatus.NO_TOUCH;
    } else {
      since = OptionalInt.of(cadence - dueIn);
      due = OptionalInt.of(dueIn);
      next = Optional.of(TODAY.plusDays(dueIn));
      lastTouch = Optional.of(TODAY.minusDays(cadence - dueIn));
      status = dueIn < 0 ? TouchStatus.OVERDUE : dueIn <= 14 ? TouchStatus.DUE_SOON : TouchStatus.ON_TRACK;
    }
    boolean stale = since.isPresent() && since.getAsInt() >= 60;
    NormalizedRecord record = new NormalizedRecord(
        1, id, "Scholar " + id, "Cohort A", Optional.ofNullable(owner), "sms", lastTouch, risk, Set.of());
    TouchAssessment assessment = new TouchAssessment(tier, cadence, since, next, due, status, stale, false);
    return new ScoredRecord(record, assessment, score, List.of(), "Send a brief text check-in today.");
  }

  public static List<Action> ranked(List<ScoredRecord> scored) {
    return ActionOrder.rank(scored);
  }

  /** Builds a raw row from alternating header and value strings. */
  public static RawRecord row(int rowNumber, String... headerValuePairs) {
    Map<String, String> values = new LinkedHashMap<>();
    for (int i = 0; i + 1 < headerValuePairs.length; i += 2) {
      values.put(headerValuePairs[i], headerValuePairs[i + 1]);
    }
    return new RawRecord(rowNumber, values);
  }

  public static List<ScoredRecord> list(ScoredRecord... records) {
    return new ArrayList<>(List.of(records));
  }

  public static PlannerConfig config(String... keyValuePairs) {
    Map<String, String> options = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValuePairs.length; i += 2) {
      options.put(keyValuePairs[i], keyValuePairs[i + 1]);
    }
    return PlannerConfig.fromMap(options);
  }

  /** Five rows: an overdue high-risk escalation, a never-touched record, two routine rows and one bad row. */
  public static List<RawRecord> sampleRows() {
    return List.of(
        row(1, "id", "S-1", "name", "Avery", "owner", "Morgan", "channel_preference", "sms",
            "last_touch", "2024-02-21", "risk_score", "95", "flags", "safety"),
        row(2, "id", "S-2", "name", "Blake", "owner", "Morgan", "channel_preference", "call",
            "risk_score", "50"),
        row(3, "id", "S-3", "name", "Carmen", "channel_preference", "email",
            "last_touch", "2024-03-25", "risk_score", "30"),
        row(4, "id", "S-4", "name", "", "risk_score", "80"),
        row(5, "id", "S-5", "name", "Devon", "owner", "Jordan", "channel_preference", "sms",
            "last_touch", "2024-03-20", "risk_score", "60", "flags", "housing;food"));
  }

  public static PlanReport sampleReport() {
    return new PlannerEngine().run(
        sampleRows(), "fixture", PlannerConfig.defaults(), SAMPLE_TODAY, SAMPLE_GENERATED);
  }
}
