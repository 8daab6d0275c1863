package org.groupscholar.planner.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads a planner YAML file into the flat key/value form the CLI merges.
 * <p><strong>Layout:</strong> Top-level sections are {@code common}, {@code plan} and {@code seed}; the result
 * holds {@code common} overlaid by the section for the requested command. Nested mappings become dotted keys
 * ({@code cadence.high}) and scalar lists become comma-separated values ({@code highImpactFlags}).</p>
 * <p><strong>Strictness:</strong> Unknown sections, duplicate keys and non-scalar list entries are rejected so a
 * typo never silently falls back to a default.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final List<String> SECTIONS = List.of(COMMON, "plan", "seed");

  private YamlConfigLoader() {}

  /**
   * Loads the settings that apply to one command.
   *
   * @param path YAML file
   * @param command {@code plan} or {@code seed}
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or uses an unknown section
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
    if (!SECTIONS.contains(section) || COMMON.equals(section)) {
      throw new IllegalArgumentException("Unsupported config command: " + command);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = new LinkedHashMap<>();
    mapping(document, "document").forEach((name, body) -> {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(normalized)) {
        throw new IllegalArgumentException("Unknown config section '" + name + "'; expected one of " + SECTIONS);
      }
      sections.put(normalized, body);
    });

    Map<String, String> settings = new LinkedHashMap<>();
    for (String name : List.of(COMMON, section)) {
      Object body = sections.get(name);
      if (body != null) {
        flatten(mapping(body, name), "", settings);
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Yaml newYaml() {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    return new Yaml(new SafeConstructor(options));
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("YAML " + where + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("YAML " + where + " has a blank or non-text key: " + key);
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((name, value) -> {
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      if (value instanceof Map<?, ?>) {
        flatten(mapping(value, key), key, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(key, joinScalars(key, items));
      } else {
        target.put(key, value == null ? "" : value.toString());
      }
    });
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list " + key + " must hold only scalar values");
      }
      joined.add(item.toString());
    }
    return joined.toString();
  }
}
