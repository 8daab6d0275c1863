package org.groupscholar.planner.domain.aggregate;

/**
 * Day ranges used to group upcoming due dates, evaluated first-match on days until due.
 *
 * @since 0.1.0
 */
public enum HorizonBucket {
  NEXT_7_DAYS("next_7_days", 0, 7),
  NEXT_14_DAYS("next_14_days", 8, 14),
  NEXT_30_DAYS("next_30_days", 15, 30),
  LATER("later", 31, Integer.MAX_VALUE);

  private final String key;
  private final int minDays;
  private final int maxDays;

  HorizonBucket(String key, int minDays, int maxDays) {
    this.key = key;
    this.minDays = minDays;
    this.maxDays = maxDays;
  }

  public String key() {
    return key;
  }

  public int minDays() {
    return minDays;
  }

  public int maxDays() {
    return maxDays;
  }

  /**
   * Resolves the bucket for a non-negative number of days until due.
   *
   * @param dueInDays days until due; must be {@code >= 0}
   * @return matching bucket
   * @throws IllegalArgumentException when {@code dueInDays} is negative (overdue records have no bucket)
   */
  public static HorizonBucket forDueInDays(int dueInDays) {
    for (HorizonBucket bucket : values()) {
      if (dueInDays >= bucket.minDays && dueInDays <= bucket.maxDays) {
        return bucket;
      }
    }
    throw new IllegalArgumentException("dueInDays must be >= 0 (was " + dueInDays + ")");
  }
}
