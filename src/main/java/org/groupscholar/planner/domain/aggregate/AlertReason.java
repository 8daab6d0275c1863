package org.groupscholar.planner.domain.aggregate;

/**
 * Conditions that can flag an owner; an owner may trigger several at once.
 *
 * @since 0.1.0
 */
public enum AlertReason {
  /** Overdue count reached the overdue threshold. */
  OVERDUE("overdue"),
  /** Never-touched count reached the no-touch threshold. */
  NO_TOUCH("no_touch"),
  /** Caseload reached the total threshold. */
  TOTAL("total");

  private final String key;

  AlertReason(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
