package org.groupscholar.planner.application.aggregate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * Picks urgent high-risk cases for handling outside the normal queue.
 *
 * <p>Scans every action, not only the displayed top of the queue. A record qualifies when it is high tier,
 * overdue or never touched, and scores at least {@code escalationMinScore}. Raising the floor can only remove
 * candidates.</p>
 *
 * @since 0.1.0
 */
public final class EscalationSelector {
  private final double minScore;
  private final int limit;

  /**
   * Creates a selector from the run configuration.
   *
   * @param config validated planner configuration
   */
  public EscalationSelector(PlannerConfig config) {
    Objects.requireNonNull(config, "config");
    this.minScore = config.escalationMinScore();
    this.limit = config.escalationLimit();
  }

  /**
   * Tests whether a record qualifies for escalation.
   *
   * @param scored scored record
   * @return {@code true} when high tier, overdue or never touched, and at or above the floor
   */
  public boolean eligible(ScoredRecord scored) {
    return scored.tier() == RiskTier.HIGH
        && (scored.status() == TouchStatus.OVERDUE || scored.status() == TouchStatus.NO_TOUCH)
        && scored.priorityScore() >= minScore;
  }

  /**
   * Selects escalations.
   *
   * @param actions ranked actions in global order
   * @return qualifying actions in global order, at most {@code escalationLimit}
   */
  public List<Action> select(List<Action> actions) {
    Objects.requireNonNull(actions, "actions");
    List<Action> selected = new ArrayList<>();
    for (Action action : actions) {
      if (selected.size() >= limit) {
        break;
      }
      if (eligible(action.scored())) {
        selected.add(action);
      }
    }
    return List.copyOf(selected);
  }
}
