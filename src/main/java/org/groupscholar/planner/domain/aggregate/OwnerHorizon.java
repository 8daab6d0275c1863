package org.groupscholar.planner.domain.aggregate;

import java.util.Objects;

/**
 * Horizon buckets for a single owner.
 *
 * @param owner owner label
 * @param total records owned
 * @param buckets bucketed due dates with overdue and undated counts
 * @param avgPriority mean priority score, two decimals
 * @since 0.1.0
 */
public record OwnerHorizon(String owner, int total, HorizonBuckets buckets, double avgPriority) {

  public OwnerHorizon {
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(buckets, "buckets");
  }
}
