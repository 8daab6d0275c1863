package org.groupscholar.planner.domain.aggregate;

import java.util.Objects;

/**
 * Per-owner workload figures.
 *
 * @param owner owner label ({@code Unassigned} for records without one)
 * @param total caseload
 * @param overdue overdue records
 * @param dueSoon due-soon records
 * @param onTrack on-track records
 * @param noTouch never-touched records
 * @param stale stale records
 * @param highRisk high-tier records
 * @param avgPriority mean priority score, two decimals
 * @param dueWithinWindow touches due inside the capacity window (plus overdue when configured)
 * @param capacity touches the owner can make in the window
 * @param gap touches beyond capacity, never negative
 * @param capacityRatio {@code dueWithinWindow / capacity}, two decimals
 * @since 0.1.0
 */
public record OwnerLoadSummary(
    String owner,
    int total,
    int overdue,
    int dueSoon,
    int onTrack,
    int noTouch,
    int stale,
    int highRisk,
    double avgPriority,
    int dueWithinWindow,
    int capacity,
    int gap,
    double capacityRatio) {

  public OwnerLoadSummary {
    Objects.requireNonNull(owner, "owner");
  }
}
