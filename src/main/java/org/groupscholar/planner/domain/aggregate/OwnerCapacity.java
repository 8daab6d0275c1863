package org.groupscholar.planner.domain.aggregate;

import java.util.Objects;

/**
 * Near-term demand against an owner's touch capacity.
 *
 * @param owner owner label
 * @param dueWithinWindow touches due in the capacity window (plus overdue when configured)
 * @param overdue overdue records
 * @param capacity window days times daily capacity
 * @param gap demand beyond capacity
 * @param utilization demand over capacity, two decimals
 * @since 0.1.0
 */
public record OwnerCapacity(
    String owner, int dueWithinWindow, int overdue, int capacity, int gap, double utilization) {

  public OwnerCapacity {
    Objects.requireNonNull(owner, "owner");
  }
}
