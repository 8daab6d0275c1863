package org.groupscholar.planner.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Planner command arguments: {@code key=value} settings in the order given, plus switches such as
 * {@code --dry-run} or {@code --explain}.
 *
 * @param settings {@code key=value} tokens, trimmed
 * @param switches normalized switch names, always with a leading {@code --}
 * @since 0.1.0
 */
public record CliInput(List<String> settings, Set<String> switches) {
  private static final String HELP = "--help";
  private static final String VERBOSE = "--verbose";
  private static final Map<String, String> ALIASES = Map.of(
      "-h", HELP,
      "help", HELP,
      "-v", VERBOSE,
      "--debug", VERBOSE);

  public CliInput {
    settings = List.copyOf(settings);
    switches = Set.copyOf(switches);
  }

  /**
   * Splits raw arguments. A token is a switch when it starts with {@code -} and has no {@code =}; the words
   * {@code help} and the short forms {@code -h}/{@code -v} map onto {@code --help}/{@code --verbose}.
   *
   * @param args raw arguments; {@code null} and blank tokens are ignored
   * @return split arguments
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<String> switches = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String token = raw.trim();
        String normalized = ALIASES.getOrDefault(token.toLowerCase(Locale.ROOT), token.toLowerCase(Locale.ROOT));
        if (normalized.equals(HELP) || (token.startsWith("-") && !token.contains("="))) {
          switches.add(normalized);
        } else {
          settings.add(token);
        }
      }
    }
    return new CliInput(settings, switches);
  }

  /** Settings tokens in the form {@link CliArgsParser#toMap(String[])} accepts. */
  public String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }

  public boolean help() {
    return switches.contains(HELP);
  }

  public boolean verbose() {
    return switches.contains(VERBOSE);
  }

  public boolean hasFlag(String name) {
    return name != null && switches.contains(name.trim().toLowerCase(Locale.ROOT));
  }
}
