package org.groupscholar.planner.application.normalize;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical field names and the header aliases accepted for each, in lookup order.
 *
 * <p>Headers match case-insensitively after trimming. When several aliases of one field are present, the first
 * alias with a non-blank value wins.</p>
 *
 * @since 0.1.0
 */
public final class HeaderAliases {
  public static final String ID = "id";
  public static final String NAME = "name";
  public static final String COHORT = "cohort";
  public static final String OWNER = "owner";
  public static final String CHANNEL_PREFERENCE = "channel_preference";
  public static final String LAST_TOUCH = "last_touch";
  public static final String RISK_SCORE = "risk_score";
  public static final String FLAGS = "flags";

  private static final HeaderAliases STANDARD = new HeaderAliases(standardTable());

  private final Map<String, List<String>> aliases;

  /**
   * Creates an alias table.
   *
   * @param aliases canonical name to aliases in lookup order
   */
  public HeaderAliases(Map<String, List<String>> aliases) {
    Objects.requireNonNull(aliases, "aliases");
    Map<String, List<String>> copy = new LinkedHashMap<>();
    aliases.forEach((canonical, names) -> {
      if (names == null || names.isEmpty()) {
        throw new IllegalArgumentException("field " + canonical + " needs at least one alias");
      }
      copy.put(canonical, names.stream().map(HeaderAliases::normalizeHeader).toList());
    });
    this.aliases = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the standard alias table.
   *
   * @return shared immutable instance
   */
  public static HeaderAliases standard() {
    return STANDARD;
  }

  /**
   * Returns the aliases configured for a canonical field.
   *
   * @param canonical canonical field name
   * @return aliases in lookup order, empty when the field is unknown
   */
  public List<String> aliasesFor(String canonical) {
    return aliases.getOrDefault(canonical, List.of());
  }

  /**
   * Indexes a row by normalized header so repeated lookups avoid rescanning.
   *
   * @param values raw header to value map
   * @return view used by {@link #lookup(Row, String)}
   */
  public Row index(Map<String, String> values) {
    Map<String, String> byHeader = new HashMap<>();
    values.forEach((header, value) -> {
      if (header != null) {
        byHeader.putIfAbsent(normalizeHeader(header), value);
      }
    });
    return new Row(byHeader);
  }

  /**
   * Resolves a canonical field from an indexed row.
   *
   * @param row indexed row
   * @param canonical canonical field name
   * @return trimmed value of the first alias carrying a non-blank value
   */
  public Optional<String> lookup(Row row, String canonical) {
    for (String alias : aliasesFor(canonical)) {
      String value = row.byHeader.get(alias);
      if (value != null && !value.isBlank()) {
        return Optional.of(value.trim());
      }
    }
    return Optional.empty();
  }

  private static String normalizeHeader(String header) {
    return header.trim().toLowerCase(Locale.ROOT);
  }

  private static Map<String, List<String>> standardTable() {
    Map<String, List<String>> table = new LinkedHashMap<>();
    table.put(ID, List.of("id", "scholar_id"));
    table.put(NAME, List.of("name"));
    table.put(COHORT, List.of("cohort"));
    table.put(OWNER, List.of("owner", "advisor", "case_manager", "coach"));
    table.put(CHANNEL_PREFERENCE, List.of("channel_preference", "preferred_channel"));
    table.put(LAST_TOUCH, List.of("last_touch", "last_contact"));
    table.put(RISK_SCORE, List.of("risk_score", "risk"));
    table.put(FLAGS, List.of("flags"));
    return table;
  }

  /** Row indexed by normalized header. */
  public static final class Row {
    private final Map<String, String> byHeader;

    private Row(Map<String, String> byHeader) {
      this.byHeader = byHeader;
    }
  }
}
