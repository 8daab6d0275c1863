package org.groupscholar.planner.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each planner CLI mode.
 *
 * <p>The {@code seed} mode reproduces the fixed settings used to load sample data into a fresh database: it
 * folds overdue records into the forecast and always persists.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  /** Input used by {@code seed} when none is given. */
  public static final String SEED_INPUT = "data/sample.csv";

  /** Schema used by the run store when none is given. */
  public static final String DEFAULT_DB_SCHEMA = "intervention_planner";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code plan} or {@code seed})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException when the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "plan" -> buildPlanDefaults();
      case "seed" -> buildSeedDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>(PlannerConfig.defaults().toMap());
    map.put("dbSchema", DEFAULT_DB_SCHEMA);
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildPlanDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("persist", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildSeedDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", SEED_INPUT);
    map.put("forecastIncludeOverdue", "true");
    map.put("persist", "true");
    map.put("dryRun", "false");
    return map;
  }
}
