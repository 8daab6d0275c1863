package org.groupscholar.planner.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.validation.Numbers;

/**
 * <strong>What:</strong> Every knob that shapes one planner run: risk thresholds, timing windows, list sizes,
 * alert thresholds, forecast and capacity settings, scoring weights and the invalid-date policy.
 * <p><strong>Why:</strong> The engine carries no process-wide state, so a run is fully described by this value
 * plus the input and "today".</p>
 * <p><strong>Role:</strong> Validated configuration aggregate handed from the CLI/YAML layer to the engine.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject out-of-order thresholds, negative limits and empty windows before any record is scored.</li>
 *   <li>Expose a flat string snapshot for reports and the run store.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed; safe for concurrent reads.</p>
 *
 * @param highRisk risk score at or above which a record is high tier
 * @param mediumRisk risk score at or above which a record is medium tier; must be below {@code highRisk}
 * @param soonDays a record is due soon when its next due date is at most this many days away
 * @param staleDays days since touch at which a record becomes stale
 * @param staleBoost score added to stale records
 * @param flagWeight score added per high-impact flag
 * @param highImpactFlags lower-case flags that raise priority
 * @param cadence per-tier touch cadence
 * @param limit actions shown in the console queue
 * @param cohortLimit cohort hotspots kept
 * @param ownerLimit owners shown in the load, horizon and capacity tables
 * @param ownerQueueLimit owners that receive a queue
 * @param ownerQueueSize actions per owner queue
 * @param channelBatchPool global top actions considered for channel batching
 * @param channelBatchLimit channels kept
 * @param channelBatchSize actions sampled per channel
 * @param escalationLimit escalations kept
 * @param escalationMinScore minimum priority score for escalation
 * @param alertOverdue overdue count that triggers an owner alert
 * @param alertNoTouch never-touched count that triggers an owner alert
 * @param alertTotal caseload that triggers an owner alert
 * @param forecastWindowDays number of forecast days
 * @param forecastIncludeOverdue whether overdue records are added to forecast day 0
 * @param capacityWindowDays days of near-term demand compared against capacity
 * @param dailyCapacity touches an owner can make per day
 * @param capacityIncludeOverdue whether overdue records count as near-term demand
 * @param invalidDatePolicy treatment of unparseable last-touch dates
 * @param explain whether priority reasons are produced
 * @since 0.1.0
 */
public record PlannerConfig(
    int highRisk,
    int mediumRisk,
    int soonDays,
    int staleDays,
    double staleBoost,
    double flagWeight,
    Set<String> highImpactFlags,
    CadencePolicy cadence,
    int limit,
    int cohortLimit,
    int ownerLimit,
    int ownerQueueLimit,
    int ownerQueueSize,
    int channelBatchPool,
    int channelBatchLimit,
    int channelBatchSize,
    int escalationLimit,
    double escalationMinScore,
    int alertOverdue,
    int alertNoTouch,
    int alertTotal,
    int forecastWindowDays,
    boolean forecastIncludeOverdue,
    int capacityWindowDays,
    int dailyCapacity,
    boolean capacityIncludeOverdue,
    InvalidDatePolicy invalidDatePolicy,
    boolean explain) {

  /** Flags that raise priority unless configured otherwise. */
  public static final Set<String> DEFAULT_HIGH_IMPACT_FLAGS =
      Collections.unmodifiableSet(
          new LinkedHashSet<>(List.of("crisis", "housing", "food", "health", "safety", "financial")));

  public PlannerConfig {
    Numbers.requireRange("highRisk", highRisk, 0, 100);
    Numbers.requireRange("mediumRisk", mediumRisk, 0, 100);
    if (mediumRisk >= highRisk) {
      throw new IllegalArgumentException(
          "mediumRisk must be below highRisk (was mediumRisk=" + mediumRisk + ", highRisk=" + highRisk + ")");
    }
    Numbers.requireAtLeast("soonDays", soonDays, 0);
    Numbers.requireAtLeast("staleDays", staleDays, 1);
    requireNonNegative("staleBoost", staleBoost);
    requireNonNegative("flagWeight", flagWeight);
    highImpactFlags = normalizeFlags(highImpactFlags);
    Objects.requireNonNull(cadence, "cadence");
    for (RiskTier tier : RiskTier.values()) {
      int days = cadence.cadenceDays(tier);
      if (days < 1) {
        throw new IllegalArgumentException("cadence." + tier.label() + " must be >= 1 (was " + days + ")");
      }
    }
    requireCadenceOrder(cadence, RiskTier.HIGH, RiskTier.MEDIUM);
    requireCadenceOrder(cadence, RiskTier.MEDIUM, RiskTier.LOW);
    Numbers.requireAtLeast("limit", limit, 0);
    Numbers.requireAtLeast("cohortLimit", cohortLimit, 0);
    Numbers.requireAtLeast("ownerLimit", ownerLimit, 0);
    Numbers.requireAtLeast("ownerQueueLimit", ownerQueueLimit, 0);
    Numbers.requireAtLeast("ownerQueueSize", ownerQueueSize, 0);
    Numbers.requireAtLeast("channelBatchPool", channelBatchPool, 0);
    Numbers.requireAtLeast("channelBatchLimit", channelBatchLimit, 0);
    Numbers.requireAtLeast("channelBatchSize", channelBatchSize, 0);
    Numbers.requireAtLeast("escalationLimit", escalationLimit, 0);
    requireNonNegative("escalationMinScore", escalationMinScore);
    Numbers.requireAtLeast("alertOverdue", alertOverdue, 0);
    Numbers.requireAtLeast("alertNoTouch", alertNoTouch, 0);
    Numbers.requireAtLeast("alertTotal", alertTotal, 0);
    Numbers.requireAtLeast("forecastWindowDays", forecastWindowDays, 1);
    Numbers.requireAtLeast("capacityWindowDays", capacityWindowDays, 1);
    Numbers.requireAtLeast("dailyCapacity", dailyCapacity, 1);
    Objects.requireNonNull(invalidDatePolicy, "invalidDatePolicy");
  }

  /**
   * Returns the configuration used when no option is supplied.
   *
   * @return default planner configuration
   */
  public static PlannerConfig defaults() {
    return new PlannerConfig(
        70,
        40,
        14,
        60,
        15.0,
        8.0,
        DEFAULT_HIGH_IMPACT_FLAGS,
        CadencePolicy.STANDARD,
        10,
        5,
        5,
        5,
        3,
        20,
        4,
        3,
        5,
        90.0,
        2,
        1,
        8,
        21,
        false,
        7,
        3,
        true,
        InvalidDatePolicy.NEVER_TOUCHED,
        false);
  }

  /**
   * Builds a configuration from flat string options, using {@link #defaults()} for absent or blank keys.
   *
   * <p>Keys not listed here (for example {@code in} or {@code json}) are ignored.</p>
   *
   * @param options flattened key/value options; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value cannot be parsed or violates a constraint
   */
  public static PlannerConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PlannerConfig defaults = defaults();
    CadencePolicy cadence =
        CadencePolicy.of(
            intOption(options, "cadence.high", defaults.cadence().cadenceDays(RiskTier.HIGH)),
            intOption(options, "cadence.medium", defaults.cadence().cadenceDays(RiskTier.MEDIUM)),
            intOption(options, "cadence.low", defaults.cadence().cadenceDays(RiskTier.LOW)));
    return new PlannerConfig(
        intOption(options, "highRisk", defaults.highRisk()),
        intOption(options, "mediumRisk", defaults.mediumRisk()),
        intOption(options, "soonDays", defaults.soonDays()),
        intOption(options, "staleDays", defaults.staleDays()),
        doubleOption(options, "staleBoost", defaults.staleBoost()),
        doubleOption(options, "flagWeight", defaults.flagWeight()),
        flagsOption(options, "highImpactFlags", defaults.highImpactFlags()),
        cadence,
        intOption(options, "limit", defaults.limit()),
        intOption(options, "cohortLimit", defaults.cohortLimit()),
        intOption(options, "ownerLimit", defaults.ownerLimit()),
        intOption(options, "ownerQueueLimit", defaults.ownerQueueLimit()),
        intOption(options, "ownerQueueSize", defaults.ownerQueueSize()),
        intOption(options, "channelBatchPool", defaults.channelBatchPool()),
        intOption(options, "channelBatchLimit", defaults.channelBatchLimit()),
        intOption(options, "channelBatchSize", defaults.channelBatchSize()),
        intOption(options, "escalationLimit", defaults.escalationLimit()),
        doubleOption(options, "escalationMinScore", defaults.escalationMinScore()),
        intOption(options, "alertOverdue", defaults.alertOverdue()),
        intOption(options, "alertNoTouch", defaults.alertNoTouch()),
        intOption(options, "alertTotal", defaults.alertTotal()),
        intOption(options, "forecastWindowDays", defaults.forecastWindowDays()),
        booleanOption(options, "forecastIncludeOverdue", defaults.forecastIncludeOverdue()),
        intOption(options, "capacityWindowDays", defaults.capacityWindowDays()),
        intOption(options, "dailyCapacity", defaults.dailyCapacity()),
        booleanOption(options, "capacityIncludeOverdue", defaults.capacityIncludeOverdue()),
        InvalidDatePolicy.parse(options.get("invalidDatePolicy"), defaults.invalidDatePolicy()),
        booleanOption(options, "explain", defaults.explain()));
  }

  /**
   * Returns the configuration as flat string options accepted by {@link #fromMap(Map)}.
   *
   * @return insertion-ordered unmodifiable snapshot
   */
  public Map<String, String> toMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("highRisk", Integer.toString(highRisk));
    map.put("mediumRisk", Integer.toString(mediumRisk));
    map.put("soonDays", Integer.toString(soonDays));
    map.put("staleDays", Integer.toString(staleDays));
    map.put("staleBoost", Double.toString(staleBoost));
    map.put("flagWeight", Double.toString(flagWeight));
    map.put("highImpactFlags", String.join(",", highImpactFlags));
    for (RiskTier tier : RiskTier.values()) {
      map.put("cadence." + tier.label(), Integer.toString(cadence.cadenceDays(tier)));
    }
    map.put("limit", Integer.toString(limit));
    map.put("cohortLimit", Integer.toString(cohortLimit));
    map.put("ownerLimit", Integer.toString(ownerLimit));
    map.put("ownerQueueLimit", Integer.toString(ownerQueueLimit));
    map.put("ownerQueueSize", Integer.toString(ownerQueueSize));
    map.put("channelBatchPool", Integer.toString(channelBatchPool));
    map.put("channelBatchLimit", Integer.toString(channelBatchLimit));
    map.put("channelBatchSize", Integer.toString(channelBatchSize));
    map.put("escalationLimit", Integer.toString(escalationLimit));
    map.put("escalationMinScore", Double.toString(escalationMinScore));
    map.put("alertOverdue", Integer.toString(alertOverdue));
    map.put("alertNoTouch", Integer.toString(alertNoTouch));
    map.put("alertTotal", Integer.toString(alertTotal));
    map.put("forecastWindowDays", Integer.toString(forecastWindowDays));
    map.put("forecastIncludeOverdue", Boolean.toString(forecastIncludeOverdue));
    map.put("capacityWindowDays", Integer.toString(capacityWindowDays));
    map.put("dailyCapacity", Integer.toString(dailyCapacity));
    map.put("capacityIncludeOverdue", Boolean.toString(capacityIncludeOverdue));
    map.put("invalidDatePolicy", invalidDatePolicy.name());
    map.put("explain", Boolean.toString(explain));
    return Collections.unmodifiableMap(map);
  }

  private static Set<String> normalizeFlags(Set<String> flags) {
    Objects.requireNonNull(flags, "highImpactFlags");
    Set<String> normalized = new LinkedHashSet<>();
    for (String flag : flags) {
      if (flag == null || flag.isBlank()) {
        throw new IllegalArgumentException("highImpactFlags must not contain blank entries");
      }
      normalized.add(flag.trim().toLowerCase(Locale.ROOT));
    }
    return Collections.unmodifiableSet(normalized);
  }

  // cadence.high <= cadence.medium <= cadence.low
  private static void requireCadenceOrder(CadencePolicy cadence, RiskTier riskier, RiskTier safer) {
    int riskierDays = cadence.cadenceDays(riskier);
    int saferDays = cadence.cadenceDays(safer);
    if (riskierDays > saferDays) {
      throw new IllegalArgumentException("cadence." + riskier.label() + " must be <= cadence." + safer.label()
          + " (was " + riskierDays + " > " + saferDays + ")");
    }
  }

  private static void requireNonNegative(String name, double value) {
    Numbers.requireRange(name, value, 0.0, Double.MAX_VALUE);
  }

  private static int intOption(Map<String, String> options, String key, int fallback) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? fallback : Numbers.parseInt(key, raw);
  }

  private static double doubleOption(Map<String, String> options, String key, double fallback) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? fallback : Numbers.parseDouble(key, raw);
  }

  private static boolean booleanOption(Map<String, String> options, String key, boolean fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1", "on" -> true;
      case "false", "no", "0", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw.trim() + "')");
    };
  }

  private static Set<String> flagsOption(Map<String, String> options, String key, Set<String> fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    Set<String> flags = new LinkedHashSet<>();
    for (String part : raw.split(",", -1)) {
      flags.add(part);
    }
    return flags;
  }
}
