package org.groupscholar.planner.application.scoring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.ScoredRecord;

/**
 * The global action order shared by every queue.
 *
 * <p>Priority score descending, then risk score descending, then days since touch descending with never-touched
 * records ahead of any touched one, then identifier ascending. Identifiers are unique within a run, so the
 * order is total and does not depend on input order or sort stability.</p>
 *
 * @since 0.1.0
 */
public final class ActionOrder {
  /** Comparator placing the most urgent record first. */
  public static final Comparator<ScoredRecord> GLOBAL =
      Comparator.comparingDouble(ScoredRecord::priorityScore).reversed()
          .thenComparing(Comparator.comparingInt((ScoredRecord scored) -> scored.record().riskScore()).reversed())
          .thenComparing(Comparator.comparingLong(ActionOrder::overdueness).reversed())
          .thenComparing(ScoredRecord::id);

  private ActionOrder() {}

  /**
   * Sorts records into the global order and assigns 1-based ranks.
   *
   * @param scored records in any order
   * @return ranked actions
   */
  public static List<Action> rank(List<ScoredRecord> scored) {
    List<ScoredRecord> sorted = new ArrayList<>(scored);
    sorted.sort(GLOBAL);
    List<Action> actions = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      actions.add(new Action(i + 1, sorted.get(i)));
    }
    return List.copyOf(actions);
  }

  private static long overdueness(ScoredRecord scored) {
    return scored.assessment().daysSinceTouch().isPresent()
        ? scored.assessment().daysSinceTouch().getAsInt()
        : Long.MAX_VALUE;
  }
}
