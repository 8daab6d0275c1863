package org.groupscholar.planner.logging;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep record names and database credentials out of logs.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate free-text values to a safe length.</li>
 *   <li>Mask passwords and user info embedded in connection strings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final Pattern USER_INFO = Pattern.compile("(//)([^/@\\s]+)@");
  private static final Pattern PASSWORD_PARAM =
      Pattern.compile("((?:password|pwd)=)([^&;\\s]*)", Pattern.CASE_INSENSITIVE);

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to {@code maxChars} characters, noting the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return truncated string when the input is longer; otherwise the original value
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars) + "... (truncated, " + maxChars + " of " + value.length() + ")";
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Masks the user-info part and any {@code password=} parameter of a connection string.
   *
   * @param url JDBC or libpq-style URL; {@code null} results in {@code "<null>"}
   * @return URL safe to log
   */
  public static String redactCredentials(String url) {
    if (url == null) {
      return NULL_PLACEHOLDER;
    }
    String masked = USER_INFO.matcher(url).replaceAll("$1" + Matcher.quoteReplacement(REDACTED_PLACEHOLDER) + "@");
    return PASSWORD_PARAM.matcher(masked).replaceAll("$1" + Matcher.quoteReplacement(REDACTED_PLACEHOLDER));
  }
}
