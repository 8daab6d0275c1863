package org.groupscholar.planner.config;

import java.util.Locale;

/**
 * Treatment of a non-blank last-touch date that cannot be parsed.
 *
 * @since 0.1.0
 */
public enum InvalidDatePolicy {
  /** Keep the row and classify it as never touched; the issue is reported but the row is scored. */
  NEVER_TOUCHED,
  /** Exclude the row from scoring. */
  REJECT;

  /**
   * Parses a policy name case-insensitively, accepting {@code -} in place of {@code _}.
   *
   * @param value raw option value; blank yields {@code fallback}
   * @param fallback value used when {@code value} is blank
   * @return resolved policy
   * @throws IllegalArgumentException when the value names no policy
   */
  public static InvalidDatePolicy parse(String value, InvalidDatePolicy fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return InvalidDatePolicy.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "invalidDatePolicy must be NEVER_TOUCHED or REJECT (was '" + value.trim() + "')", ex);
    }
  }
}
