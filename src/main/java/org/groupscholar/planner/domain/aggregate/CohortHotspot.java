package org.groupscholar.planner.domain.aggregate;

import java.util.Objects;

/**
 * Per-cohort status and tier counts.
 *
 * @param cohort cohort label ({@code Unassigned} when blank)
 * @param total records in the cohort
 * @param overdue overdue records
 * @param dueSoon due-soon records
 * @param noTouch never-touched records
 * @param highRisk high-tier records
 * @param mediumRisk medium-tier records
 * @param lowRisk low-tier records
 * @param avgPriority mean priority score, two decimals
 * @since 0.1.0
 */
public record CohortHotspot(
    String cohort,
    int total,
    int overdue,
    int dueSoon,
    int noTouch,
    int highRisk,
    int mediumRisk,
    int lowRisk,
    double avgPriority) {

  public CohortHotspot {
    Objects.requireNonNull(cohort, "cohort");
  }
}
