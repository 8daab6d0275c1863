package org.groupscholar.planner.application.scoring;

import static org.groupscholar.planner.testutil.Fixtures.TODAY;
import static org.groupscholar.planner.testutil.Fixtures.config;
import static org.groupscholar.planner.testutil.Fixtures.record;
import static org.groupscholar.planner.testutil.Fixtures.scored;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchStatus;
import org.junit.jupiter.api.Test;

class PriorityScorerTest {
  private final PlannerConfig defaults = PlannerConfig.defaults();

  @Test
  void sumsRiskStatusStaleAndFlags() {
    ScoredRecord result = scored(defaults, record("S-1", 60, TODAY.minusDays(70), "A", "sms", "housing", "food"), TODAY);

    // 60 risk + 30 overdue + 15 stale + 2 * 8 flags
    assertEquals(121.0, result.priorityScore());
    assertTrue(result.priorityReasons().isEmpty());
  }

  @Test
  void unknownFlagsAddNothing() {
    ScoredRecord plain = scored(defaults, record("S-1", 50, TODAY.minusDays(1), "A", "sms"), TODAY);
    ScoredRecord flagged = scored(defaults, record("S-2", 50, TODAY.minusDays(1), "A", "sms", "transport"), TODAY);

    assertEquals(plain.priorityScore(), flagged.priorityScore());
  }

  @Test
  void scoreIsMonotoneInRiskFlagsAndSeverity() {
    ScoredRecord base = scored(defaults, record("S-1", 50, TODAY.minusDays(10), "A", "sms"), TODAY);
    ScoredRecord riskier = scored(defaults, record("S-2", 51, TODAY.minusDays(10), "A", "sms"), TODAY);
    ScoredRecord flagged = scored(defaults, record("S-3", 50, TODAY.minusDays(10), "A", "sms", "crisis"), TODAY);
    ScoredRecord overdue = scored(defaults, record("S-4", 50, TODAY.minusDays(30), "A", "sms"), TODAY);
    ScoredRecord untouched = scored(defaults, record("S-5", 50, null, "A", "sms"), TODAY);

    assertTrue(riskier.priorityScore() > base.priorityScore());
    assertTrue(flagged.priorityScore() > base.priorityScore());
    assertTrue(overdue.priorityScore() > base.priorityScore());
    assertTrue(untouched.priorityScore() > overdue.priorityScore());
  }

  @Test
  void crossingATierBoundaryNeverLowersTheScore() {
    for (PlannerConfig config : List.of(defaults, config("cadence.high", "21", "cadence.medium", "21"))) {
      for (int risk : new int[] {config.mediumRisk() - 1, config.highRisk() - 1}) {
        for (int days = 0; days <= 80; days++) {
          LocalDate touched = TODAY.minusDays(days);
          ScoredRecord below = scored(config, record("S-1", risk, touched, "A", "sms"), TODAY);
          ScoredRecord above = scored(config, record("S-2", risk + 1, touched, "A", "sms"), TODAY);

          assertTrue(above.priorityScore() > below.priorityScore(),
              "risk " + (risk + 1) + " scored " + above.priorityScore() + " below risk " + risk + " at "
                  + below.priorityScore() + " after " + days + " days");
        }
        ScoredRecord neverBelow = scored(config, record("S-3", risk, null, "A", "sms"), TODAY);
        ScoredRecord neverAbove = scored(config, record("S-4", risk + 1, null, "A", "sms"), TODAY);
        assertTrue(neverAbove.priorityScore() > neverBelow.priorityScore());
      }
    }
  }

  @Test
  void statusPointsFollowSeverity() {
    double previous = Double.MAX_VALUE;
    for (TouchStatus status : List.of(TouchStatus.NO_TOUCH, TouchStatus.OVERDUE, TouchStatus.DUE_SOON,
        TouchStatus.ON_TRACK)) {
      double points = PriorityScorer.STATUS_POINTS.get(status);
      assertTrue(points < previous, status + " should score below the previous status");
      previous = points;
    }
  }

  @Test
  void explainModeListsReasonsInComponentOrder() {
    PlannerConfig explain = config("explain", "true");

    ScoredRecord result = scored(explain, record("S-1", 95, TODAY.minusDays(40), "A", "call", "safety"), TODAY);

    assertEquals(List.of(
        "High risk tier (risk score 95, +95)",
        "Overdue by 33 days on a 7-day cadence (+30)",
        "High-impact flags: safety (+8)"), result.priorityReasons());
    assertEquals(133.0, result.priorityScore());
    assertEquals("Schedule a short call within 48 hours. Confirm support needs and capture blockers.",
        result.recommendedAction());
  }

  @Test
  void configurableWeightsApply() {
    PlannerConfig custom = config("staleBoost", "0", "flagWeight", "2.5");

    ScoredRecord result = scored(custom, record("S-1", 10, TODAY.minusDays(90), "A", "sms", "crisis"), TODAY);

    // 10 risk + 30 overdue + 0 stale + 2.5 flag
    assertEquals(42.5, result.priorityScore());
  }

  @Test
  void roundsHalfUpToCents() {
    assertEquals(1.01, PriorityScorer.round2(1.005));
    assertEquals(0.14, PriorityScorer.round2(2.0 / 14));
  }
}
