package org.groupscholar.planner.domain.aggregate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Counts of upcoming due dates per {@link HorizonBucket}, with overdue and undated records reported beside
 * (never inside) the buckets.
 *
 * @param counts bucket to count, every bucket present
 * @param overdue records whose due date has passed
 * @param noDueDate records with no determinable due date
 * @since 0.1.0
 */
public record HorizonBuckets(Map<HorizonBucket, Integer> counts, int overdue, int noDueDate) {

  public HorizonBuckets {
    Objects.requireNonNull(counts, "counts");
    Map<HorizonBucket, Integer> copy = new EnumMap<>(HorizonBucket.class);
    for (HorizonBucket bucket : HorizonBucket.values()) {
      copy.put(bucket, counts.getOrDefault(bucket, 0));
    }
    counts = Collections.unmodifiableMap(copy);
  }

  public int count(HorizonBucket bucket) {
    return counts.get(bucket);
  }

  /**
   * Returns the number of records placed in a bucket.
   *
   * @return sum over all buckets
   */
  public int upcoming() {
    return counts.values().stream().mapToInt(Integer::intValue).sum();
  }

  /**
   * Returns every record accounted for: bucketed, overdue and undated.
   *
   * @return total records covered
   */
  public int total() {
    return upcoming() + overdue + noDueDate;
  }
}
