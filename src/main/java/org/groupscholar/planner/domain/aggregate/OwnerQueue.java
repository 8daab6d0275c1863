package org.groupscholar.planner.domain.aggregate;

import java.util.List;
import java.util.Objects;
import org.groupscholar.planner.domain.record.Action;

/**
 * Top actions for one owner, in global priority order.
 *
 * @param owner owner label
 * @param total records owned
 * @param actions leading actions
 * @since 0.1.0
 */
public record OwnerQueue(String owner, int total, List<Action> actions) {

  public OwnerQueue {
    Objects.requireNonNull(owner, "owner");
    actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
  }
}
