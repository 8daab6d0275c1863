package org.groupscholar.planner.domain.aggregate;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Owner flagged because one or more workload thresholds were reached.
 *
 * @param owner owner label
 * @param reasons every triggered condition; never empty
 * @param overdue overdue count
 * @param noTouch never-touched count
 * @param total caseload
 * @since 0.1.0
 */
public record OwnerAlert(String owner, Set<AlertReason> reasons, int overdue, int noTouch, int total) {

  public OwnerAlert {
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(reasons, "reasons");
    if (reasons.isEmpty()) {
      throw new IllegalArgumentException("an owner alert needs at least one reason");
    }
    reasons = Collections.unmodifiableSet(EnumSet.copyOf(reasons));
  }
}
