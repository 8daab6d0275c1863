package org.groupscholar.planner.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (trim(effective.get("in")).isEmpty()) {
      throw new IllegalArgumentException("in is required for " + mode);
    }
    boolean persist = parseBoolean(effective.get("persist"));
    boolean dryRun = parseBoolean(effective.get("dryRun"));
    if (persist && dryRun && "seed".equalsIgnoreCase(mode)) {
      throw new IllegalArgumentException("seed always persists and cannot run with --dry-run");
    }
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
