package org.groupscholar.planner.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by planner configuration and CLI parsing.
 * <p><strong>Why:</strong> Rejects out-of-range thresholds, limits and windows before any record is scored,
 * so a bad setting is never silently clamped.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a decimal value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value; {@code NaN} is always rejected
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is {@code NaN} or outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates a lower bound only.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value < min}
   */
  public static int requireAtLeast(String name, int value, int min) {
    if (value < min) {
      throw new IllegalArgumentException(label(name) + " must be >= " + min + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer option, naming the option in the failure message.
   *
   * @param name option name
   * @param raw raw text
   * @return parsed value
   * @throws IllegalArgumentException when {@code raw} is not an integer
   */
  public static int parseInt(String name, String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
  }

  /**
   * Parses a decimal option, naming the option in the failure message.
   *
   * @param name option name
   * @param raw raw text
   * @return parsed value
   * @throws IllegalArgumentException when {@code raw} is not a finite number
   */
  public static double parseDouble(String name, String raw) {
    double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + raw + "')", ex);
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be a finite number (was '" + raw + "')");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
