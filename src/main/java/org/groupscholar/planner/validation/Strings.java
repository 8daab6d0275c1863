package org.groupscholar.planner.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Text checks for values that end up in SQL identifiers, run labels or OTLP resource attributes.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** PostgreSQL truncates identifiers past this length. */
  public static final int MAX_IDENTIFIER_LENGTH = 63;

  private Strings() {}

  /**
   * Trims {@code value} and rejects it when blank or when it carries control characters.
   *
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or has control characters
   */
  public static String requireNonBlank(String name, String value) {
    String label = label(name);
    Objects.requireNonNull(value, label);
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Accepts an unquoted identifier such as a schema name; the run store interpolates it into DDL.
   */
  public static String requireIdentifier(String name, String value) {
    String identifier = requireNonBlank(name, value);
    if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + MAX_IDENTIFIER_LENGTH);
    }
    if (!SQL_IDENTIFIER.matcher(identifier).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must start with a letter or underscore and contain only letters, digits or underscores");
    }
    return identifier;
  }

  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String text = requireNonBlank(name, value);
    if (text.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    if (text.chars().anyMatch(c -> c < 0x20 || c > 0x7E)) {
      throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
    }
    return text;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
