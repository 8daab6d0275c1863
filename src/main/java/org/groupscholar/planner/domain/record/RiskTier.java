package org.groupscholar.planner.domain.record;

import java.util.Locale;

/**
 * Risk tier derived from a record's risk score.
 *
 * <p>Declaration order is the row order of every tier-keyed table (high first).</p>
 *
 * @since 0.1.0
 */
public enum RiskTier {
  /** Scores at or above the high-risk threshold. */
  HIGH("high"),
  /** Scores at or above the medium-risk threshold but below high. */
  MEDIUM("medium"),
  /** Everything below the medium-risk threshold. */
  LOW("low");

  private final String label;

  RiskTier(String label) {
    this.label = label;
  }

  /**
   * Returns the lower-case label used in reports and persisted rows.
   *
   * @return label such as {@code high}
   */
  public String label() {
    return label;
  }

  /**
   * Returns the capitalized display name, e.g. {@code High}.
   *
   * @return display name for console output
   */
  public String displayName() {
    return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1);
  }
}
