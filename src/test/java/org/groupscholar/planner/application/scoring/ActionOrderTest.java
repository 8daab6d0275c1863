package org.groupscholar.planner.application.scoring;

import static org.groupscholar.planner.testutil.Fixtures.assessed;
import static org.groupscholar.planner.testutil.Fixtures.withDueIn;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.junit.jupiter.api.Test;

class ActionOrderTest {

  @Test
  void ordersByScoreThenRiskThenOverduenessThenId() {
    ScoredRecord top = assessed("Z", "A", 90, -5, 150.0);
    ScoredRecord riskier = assessed("Y", "A", 80, 3, 120.0);
    ScoredRecord lessRisky = assessed("X", "A", 70, -30, 120.0);
    ScoredRecord neverTouched = assessed("W", "A", 50, null, 90.0);
    ScoredRecord touched = assessed("V", "A", 50, -40, 90.0);
    ScoredRecord tieB = withDueIn("B", "A", 2, 60.0);
    ScoredRecord tieA = withDueIn("A", "A", 2, 60.0);

    List<Action> actions = ActionOrder.rank(List.of(tieB, touched, lessRisky, tieA, top, neverTouched, riskier));

    assertEquals(List.of("Z", "Y", "X", "W", "V", "A", "B"), actions.stream().map(Action::id).toList());
    for (int i = 0; i < actions.size(); i++) {
      assertEquals(i + 1, actions.get(i).rank());
    }
  }

  @Test
  void orderDoesNotDependOnInputOrder() {
    List<ScoredRecord> records = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      records.add(withDueIn(String.format("S-%02d", i), "A", i % 5 - 2, 50.0 + (i % 3)));
    }
    List<String> expected = ActionOrder.rank(records).stream().map(Action::id).toList();

    Collections.shuffle(records, new Random(42));

    assertEquals(expected, ActionOrder.rank(records).stream().map(Action::id).toList());
  }
}
