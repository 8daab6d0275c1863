package org.groupscholar.planner.application.pipeline;

import static org.groupscholar.planner.testutil.Fixtures.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.aggregate.HorizonBucket;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.RawRecord;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchStatus;
import org.junit.jupiter.api.Test;

class PlannerEngineTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 4, 1);
  private static final Instant GENERATED = Instant.parse("2024-04-01T12:00:00Z");

  private final PlannerEngine engine = new PlannerEngine();

  private static List<RawRecord> rows() {
    return List.of(
        row(1, "id", "S-1", "name", "Avery", "owner", "Morgan", "channel_preference", "sms",
            "last_touch", "2024-02-21", "risk_score", "95", "flags", "safety"),
        row(2, "id", "S-2", "name", "Blake", "owner", "Morgan", "channel_preference", "call",
            "risk_score", "50"),
        row(3, "id", "S-3", "name", "Carmen", "owner", "Jordan", "channel_preference", "email",
            "last_touch", "2024-03-25", "risk_score", "30"),
        row(4, "id", "S-4", "name", "", "risk_score", "80"),
        row(5, "id", "S-5", "name", "Devon", "owner", "Jordan", "channel_preference", "sms",
            "last_touch", "2024-03-20", "risk_score", "60", "flags", "housing;food"));
  }

  @Test
  void overdueHighRiskRecordIsEscalated() {
    PlanReport report = engine.run(rows(), "fixture", PlannerConfig.defaults(), TODAY, GENERATED);

    ScoredRecord avery = report.actions().get(0).scored();
    assertEquals("S-1", avery.id());
    assertEquals(RiskTier.HIGH, avery.tier());
    assertEquals(TouchStatus.OVERDUE, avery.status());
    assertFalse(avery.stale());
    assertEquals(133.0, avery.priorityScore());
    assertEquals(List.of("S-1"), report.escalations().stream().map(Action::id).toList());
  }

  @Test
  void neverTouchedRecordStaysOutOfHorizonAndForecast() {
    PlanReport report = engine.run(rows(), "fixture", PlannerConfig.defaults(), TODAY, GENERATED);

    assertEquals(1, report.horizon().noDueDate());
    assertEquals(1, report.forecast().noDueDate());
    assertEquals(1, report.tierStatus().count(RiskTier.MEDIUM, TouchStatus.NO_TOUCH));
    int bucketed = 0;
    for (HorizonBucket bucket : HorizonBucket.values()) {
      bucketed += report.horizon().count(bucket);
    }
    assertEquals(report.actions().size() - 2, bucketed);
  }

  @Test
  void rejectedRowsAreCountedAndReported() {
    PlanReport report = engine.run(rows(), "fixture", PlannerConfig.defaults(), TODAY, GENERATED);

    assertEquals(5, report.metadata().rowsRead());
    assertEquals(4, report.metadata().scoredCount());
    assertEquals(1, report.metadata().rejectedCount());
    assertEquals(1, report.summary().rejected());
    assertEquals(1, report.issues().size());
    assertEquals(4, report.issues().get(0).rowNumber());
  }

  @Test
  void runIsIdempotentAndIndependentOfRowOrder() {
    PlanReport first = engine.run(rows(), "fixture", PlannerConfig.defaults(), TODAY, GENERATED);
    List<RawRecord> shuffled = new ArrayList<>(rows());
    Collections.shuffle(shuffled, new Random(7));

    PlanReport again = engine.run(rows(), "fixture", PlannerConfig.defaults(), TODAY, GENERATED);
    PlanReport reordered = engine.run(shuffled, "fixture", PlannerConfig.defaults(), TODAY, GENERATED);

    assertEquals(first, again);
    assertEquals(ids(first), ids(reordered));
    assertEquals(first.tierStatus(), reordered.tierStatus());
    assertEquals(first.ownerLoads(), reordered.ownerLoads());
    assertEquals(first.channelBatches(), reordered.channelBatches());
  }

  @Test
  void emptyInputProducesEmptyReport() {
    PlanReport report = engine.run(List.of(), "empty", PlannerConfig.defaults(), TODAY, GENERATED);

    assertTrue(report.actions().isEmpty());
    assertEquals(0, report.tierStatus().total());
    assertEquals(21, report.forecast().daily().size());
    assertEquals(0, report.forecast().total());
    assertEquals(0.0, report.cadenceAdherence().overall().complianceRate());
    assertEquals(3, report.cadenceGuidance().size());
  }

  @Test
  void configSnapshotTravelsWithReport() {
    PlanReport report = engine.run(rows(), "fixture", PlannerConfig.defaults(), TODAY, GENERATED);

    assertEquals("fixture", report.metadata().source());
    assertEquals(TODAY, report.metadata().today());
    assertEquals("70", report.metadata().config().get("highRisk"));
  }

  private static List<String> ids(PlanReport report) {
    return report.actions().stream().map(Action::id).toList();
  }
}
