package org.groupscholar.planner.domain.record;

import java.util.Objects;

/**
 * A scored record placed in the global priority order; the unit carried by every queue.
 *
 * @param rank 1-based position in the global order
 * @param scored scored record
 * @since 0.1.0
 */
public record Action(int rank, ScoredRecord scored) {

  public Action {
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be >= 1 (was " + rank + ")");
    }
    Objects.requireNonNull(scored, "scored");
  }

  public String id() {
    return scored.id();
  }

  public double priorityScore() {
    return scored.priorityScore();
  }
}
