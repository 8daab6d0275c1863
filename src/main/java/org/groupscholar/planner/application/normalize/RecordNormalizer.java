package org.groupscholar.planner.application.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.groupscholar.planner.config.InvalidDatePolicy;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.RawRecord;
import org.groupscholar.planner.domain.record.RecordIssue;
import org.groupscholar.planner.domain.record.RecordIssue.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts raw rows into {@link NormalizedRecord}s.
 * <p><strong>Why:</strong> Intake exports name the same column differently ({@code scholar_id}, {@code advisor},
 * {@code last_contact}) and carry free-form dates and scores; the engine needs one typed shape.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve header aliases and trim values.</li>
 *   <li>Parse dates ({@code yyyy-MM-dd}, {@code MM/dd/yyyy}, {@code yyyy/MM/dd}) and round/clamp risk scores.</li>
 *   <li>Collect {@link RecordIssue}s and exclude bad rows without aborting the run.</li>
 *   <li>Keep the first row for a repeated identifier.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless after construction; each call keeps its own duplicate set.</p>
 *
 * @since 0.1.0
 */
public final class RecordNormalizer {
  private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);
  private static final BigDecimal HALF_POINT = new BigDecimal("0.5");
  private static final BigDecimal MAX_RISK = BigDecimal.valueOf(100);

  private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
      DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT));

  /** Channel recorded when a row names none. */
  public static final String UNKNOWN_CHANNEL = "unknown";

  private final HeaderAliases aliases;
  private final InvalidDatePolicy invalidDatePolicy;

  /**
   * Creates a normalizer.
   *
   * @param aliases header alias table
   * @param invalidDatePolicy treatment of unparseable last-touch dates
   */
  public RecordNormalizer(HeaderAliases aliases, InvalidDatePolicy invalidDatePolicy) {
    this.aliases = Objects.requireNonNull(aliases, "aliases");
    this.invalidDatePolicy = Objects.requireNonNull(invalidDatePolicy, "invalidDatePolicy");
  }

  /**
   * Normalizes all rows.
   *
   * @param rows raw rows in source order
   * @return accepted records and collected issues
   */
  public NormalizationResult normalize(List<RawRecord> rows) {
    Objects.requireNonNull(rows, "rows");
    List<NormalizedRecord> accepted = new ArrayList<>(rows.size());
    List<RecordIssue> issues = new ArrayList<>();
    Set<String> seenIds = new HashSet<>();
    int rejected = 0;

    for (RawRecord row : rows) {
      List<PendingIssue> pending = new ArrayList<>();
      HeaderAliases.Row indexed = aliases.index(row.values());
      Optional<NormalizedRecord> record = normalizeRow(row, indexed, pending);
      if (record.isPresent() && !seenIds.add(record.get().id())) {
        pending.add(new PendingIssue(Kind.DUPLICATE_ID, HeaderAliases.ID,
            "duplicate id " + record.get().id() + "; first occurrence kept", true));
        record = Optional.empty();
      }
      boolean excluded = record.isEmpty();
      Optional<String> recordId = aliases.lookup(indexed, HeaderAliases.ID);
      for (PendingIssue issue : pending) {
        issues.add(new RecordIssue(
            row.rowNumber(), recordId, issue.kind(), issue.field(), issue.message(), excluded || issue.excludes()));
      }
      if (excluded) {
        rejected++;
      } else {
        accepted.add(record.get());
      }
    }

    log.debug("Normalized {} rows: {} accepted, {} rejected, {} issues",
        rows.size(), accepted.size(), rejected, issues.size());
    return new NormalizationResult(rows.size(), accepted, issues, rejected);
  }

  private Optional<NormalizedRecord> normalizeRow(
      RawRecord row, HeaderAliases.Row indexed, List<PendingIssue> pending) {
    Optional<String> id = aliases.lookup(indexed, HeaderAliases.ID);
    Optional<String> name = aliases.lookup(indexed, HeaderAliases.NAME);
    Optional<String> riskRaw = aliases.lookup(indexed, HeaderAliases.RISK_SCORE);

    if (id.isEmpty()) {
      pending.add(missing(HeaderAliases.ID));
    }
    if (name.isEmpty()) {
      pending.add(missing(HeaderAliases.NAME));
    }
    Integer riskScore = null;
    if (riskRaw.isEmpty()) {
      pending.add(missing(HeaderAliases.RISK_SCORE));
    } else {
      riskScore = parseRiskScore(riskRaw.get());
      if (riskScore == null) {
        pending.add(new PendingIssue(Kind.INVALID_SCORE, HeaderAliases.RISK_SCORE,
            "risk_score is not numeric: '" + riskRaw.get() + "'", true));
      }
    }

    Optional<String> touchRaw = aliases.lookup(indexed, HeaderAliases.LAST_TOUCH);
    Optional<LocalDate> lastTouch = Optional.empty();
    if (touchRaw.isPresent()) {
      lastTouch = parseDate(touchRaw.get());
      if (lastTouch.isEmpty()) {
        boolean reject = invalidDatePolicy == InvalidDatePolicy.REJECT;
        pending.add(new PendingIssue(Kind.INVALID_DATE, HeaderAliases.LAST_TOUCH,
            "last_touch is not a recognised date: '" + touchRaw.get() + "'"
                + (reject ? "" : "; treated as never touched"),
            reject));
      }
    }

    boolean excluded = pending.stream().anyMatch(PendingIssue::excludes);
    if (excluded) {
      return Optional.empty();
    }
    return Optional.of(new NormalizedRecord(
        row.rowNumber(),
        id.get(),
        name.get(),
        aliases.lookup(indexed, HeaderAliases.COHORT).orElse(""),
        aliases.lookup(indexed, HeaderAliases.OWNER),
        canonicalChannel(aliases.lookup(indexed, HeaderAliases.CHANNEL_PREFERENCE).orElse("")),
        lastTouch,
        riskScore,
        parseFlags(aliases.lookup(indexed, HeaderAliases.FLAGS).orElse(""))));
  }

  /**
   * Parses a risk score, rounding half-up to an integer and clamping to {@code [0, 100]}.
   *
   * @param raw trimmed text
   * @return clamped score, or {@code null} when the text is not a finite number
   */
  static Integer parseRiskScore(String raw) {
    BigDecimal value;
    try {
      value = new BigDecimal(raw.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
    // clamp before rounding; setScale on an extreme exponent overflows
    if (value.compareTo(HALF_POINT) < 0) {
      return 0;
    }
    if (value.compareTo(MAX_RISK) > 0) {
      return 100;
    }
    return value.setScale(0, RoundingMode.HALF_UP).intValueExact();
  }

  /**
   * Parses a date in any accepted format.
   *
   * @param raw trimmed text
   * @return parsed date, or empty when no format matches
   */
  public static Optional<LocalDate> parseDate(String raw) {
    String value = raw == null ? "" : raw.trim();
    if (value.isEmpty()) {
      return Optional.empty();
    }
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return Optional.of(LocalDate.parse(value, format));
      } catch (DateTimeParseException ignored) {
        // try the next format
      }
    }
    return Optional.empty();
  }

  /**
   * Maps channel spellings onto canonical names.
   *
   * @param raw channel text
   * @return {@code sms}, {@code call}, {@link #UNKNOWN_CHANNEL} or the lower-cased input
   */
  public static String canonicalChannel(String raw) {
    String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "" -> UNKNOWN_CHANNEL;
      case "sms", "text" -> "sms";
      case "phone", "call" -> "call";
      default -> value;
    };
  }

  static Set<String> parseFlags(String raw) {
    Set<String> flags = new LinkedHashSet<>();
    for (String part : raw.split(";")) {
      String flag = part.trim().toLowerCase(Locale.ROOT);
      if (!flag.isEmpty()) {
        flags.add(flag);
      }
    }
    return flags;
  }

  private static PendingIssue missing(String field) {
    return new PendingIssue(Kind.MISSING_FIELD, field, field + " is missing or blank", true);
  }

  private record PendingIssue(Kind kind, String field, String message, boolean excludes) {}
}
