package org.groupscholar.planner.application.aggregate;

import static org.groupscholar.planner.testutil.Fixtures.config;
import static org.groupscholar.planner.testutil.Fixtures.ranked;
import static org.groupscholar.planner.testutil.Fixtures.record;
import static org.groupscholar.planner.testutil.Fixtures.scored;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchStatus;
import org.junit.jupiter.api.Test;

class EscalationSelectorTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 4, 1);

  @Test
  void selectsHighRiskOverdueAboveFloor() {
    PlannerConfig config = config("escalationMinScore", "100");
    ScoredRecord avery = scored(config, record("avery", 92, TODAY.minusDays(40), "M", "sms", "housing"), TODAY);
    ScoredRecord blake = scored(config, record("blake", 95, TODAY.minusDays(2), "M", "call"), TODAY);
    ScoredRecord carmen = scored(config, record("carmen", 55, TODAY.minusDays(50), "J", "email"), TODAY);

    List<Action> escalations = new EscalationSelector(config).select(ranked(List.of(avery, blake, carmen)));

    assertEquals(130.0, avery.priorityScore());
    assertEquals(1, escalations.size());
    assertEquals("avery", escalations.get(0).id());
  }

  @Test
  void neverTouchedHighRiskQualifies() {
    PlannerConfig config = PlannerConfig.defaults();
    ScoredRecord untouched = scored(config, record("s", 70, null, "M", "sms"), TODAY);

    assertTrue(new EscalationSelector(config).eligible(untouched));
  }

  @Test
  void mediumTierNeverEscalates() {
    PlannerConfig config = config("escalationMinScore", "0");
    ScoredRecord medium = scored(config, record("s", 69, null, "M", "sms", "crisis", "housing"), TODAY);

    assertFalse(new EscalationSelector(config).eligible(medium));
  }

  @Test
  void selectionRespectsLimitAndGlobalOrder() {
    PlannerConfig config = config("escalationLimit", "2");
    List<ScoredRecord> records = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      records.add(scored(config, record("s" + i, 80 + i, TODAY.minusDays(30), "M", "sms"), TODAY));
    }

    List<Action> escalations = new EscalationSelector(config).select(ranked(records));

    assertEquals(List.of("s3", "s2"), escalations.stream().map(Action::id).toList());
    assertEquals(1, escalations.get(0).rank());
  }

  @Test
  void raisingTheFloorOnlyRemovesEscalations() {
    PlannerConfig scoring = PlannerConfig.defaults();
    List<ScoredRecord> records = new ArrayList<>();
    Integer[] touchAges = {null, 2, 10, 25, 40, 90};
    for (int risk = 30; risk <= 100; risk += 7) {
      for (Integer age : touchAges) {
        LocalDate touched = age == null ? null : TODAY.minusDays(age);
        String flag = risk % 2 == 0 ? "housing" : "transport";
        records.add(scored(scoring, record("s" + risk + "-" + age, risk, touched, "M", "sms", flag), TODAY));
      }
    }
    List<Action> actions = ranked(records);
    Set<String> urgentHigh = records.stream()
        .filter(r -> r.tier() == RiskTier.HIGH)
        .filter(r -> r.status() == TouchStatus.OVERDUE || r.status() == TouchStatus.NO_TOUCH)
        .map(ScoredRecord::id)
        .collect(Collectors.toSet());

    Set<String> previous = null;
    for (String floor : List.of("0", "60", "90", "110", "125", "140", "1000")) {
      PlannerConfig config = config("escalationMinScore", floor, "escalationLimit", "500");
      Set<String> selected = new EscalationSelector(config).select(actions).stream()
          .map(Action::id)
          .collect(Collectors.toSet());

      assertTrue(urgentHigh.containsAll(selected), "floor " + floor + " selected a non-urgent record");
      if (previous != null) {
        assertTrue(previous.containsAll(selected), "floor " + floor + " added escalations");
      }
      previous = selected;
    }
    assertEquals(urgentHigh.size(), new EscalationSelector(config("escalationMinScore", "0", "escalationLimit", "500"))
        .select(actions).size());
    assertTrue(previous.isEmpty());
  }
}
