package org.groupscholar.planner.api;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Helpers shared by the commands for reading merged CLI/YAML settings.
 */
final class ConfigCliUtils {
  private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1", "on");

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
  }

  static Optional<String> optional(Map<String, String> map, String key) {
    String value = map.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  /**
   * Parses the {@code today} override.
   *
   * @throws IllegalArgumentException when the value is not {@code YYYY-MM-DD}
   */
  static Optional<LocalDate> parseToday(Map<String, String> map) {
    Optional<String> raw = optional(map, "today");
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.parse(raw.get()));
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("today must use YYYY-MM-DD (was '" + raw.get() + "')", ex);
    }
  }
}
