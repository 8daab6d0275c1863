package org.groupscholar.planner.application.scoring;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import org.groupscholar.planner.config.CadencePolicy;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.TouchAssessment;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * <strong>What:</strong> Assigns each record a risk tier, cadence, due arithmetic and touch status.
 * <p><strong>How:</strong> Tier and status are ordered rule tables evaluated first-match, so adding a tier or
 * status means adding a row rather than another branch.</p>
 * <p><strong>Future dates:</strong> A last touch after "today" is clamped to today and flagged as
 * {@link TouchAssessment#futureTouchDate()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class TouchpointClassifier {
  private final List<TierRule> tierRules;
  private final List<StatusRule> statusRules;
  private final CadencePolicy cadence;
  private final int staleDays;

  /**
   * Creates a classifier from the run configuration.
   *
   * @param config validated planner configuration
   */
  public TouchpointClassifier(PlannerConfig config) {
    Objects.requireNonNull(config, "config");
    this.cadence = config.cadence();
    this.staleDays = config.staleDays();
    int soonDays = config.soonDays();
    this.tierRules = List.of(
        new TierRule(config.highRisk(), RiskTier.HIGH),
        new TierRule(config.mediumRisk(), RiskTier.MEDIUM),
        new TierRule(Integer.MIN_VALUE, RiskTier.LOW));
    this.statusRules = List.of(
        new StatusRule(TouchStatus.NO_TOUCH, facts -> facts.daysSinceTouch().isEmpty()),
        new StatusRule(TouchStatus.OVERDUE, facts -> facts.daysSinceTouch().getAsInt() > facts.cadenceDays()),
        new StatusRule(TouchStatus.DUE_SOON, facts -> {
          int dueIn = facts.dueInDays().getAsInt();
          return dueIn >= 0 && dueIn <= soonDays;
        }),
        new StatusRule(TouchStatus.ON_TRACK, facts -> true));
  }

  /**
   * Resolves the tier for a risk score.
   *
   * @param riskScore score in {@code [0, 100]}
   * @return first tier whose threshold the score reaches
   */
  public RiskTier tierFor(int riskScore) {
    for (TierRule rule : tierRules) {
      if (riskScore >= rule.minScore()) {
        return rule.tier();
      }
    }
    throw new IllegalStateException("tier rules must end with a catch-all");
  }

  /**
   * Classifies one record.
   *
   * @param record normalized record
   * @param today run date
   * @return assessment
   */
  public TouchAssessment classify(NormalizedRecord record, LocalDate today) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(today, "today");
    RiskTier tier = tierFor(record.riskScore());
    int cadenceDays = cadence.cadenceDays(tier);

    Optional<LocalDate> source = record.lastTouchDate();
    boolean future = source.isPresent() && source.get().isAfter(today);
    Optional<LocalDate> effective = future ? Optional.of(today) : source;

    OptionalInt daysSince = OptionalInt.empty();
    Optional<LocalDate> nextDue = Optional.empty();
    OptionalInt dueIn = OptionalInt.empty();
    if (effective.isPresent()) {
      LocalDate touched = effective.get();
      daysSince = OptionalInt.of(Math.toIntExact(ChronoUnit.DAYS.between(touched, today)));
      LocalDate due = touched.plusDays(cadenceDays);
      nextDue = Optional.of(due);
      dueIn = OptionalInt.of(Math.toIntExact(ChronoUnit.DAYS.between(today, due)));
    }

    Facts facts = new Facts(cadenceDays, daysSince, dueIn);
    TouchStatus status = statusFor(facts);
    boolean stale = daysSince.isPresent() && daysSince.getAsInt() >= staleDays;
    return new TouchAssessment(tier, cadenceDays, daysSince, nextDue, dueIn, status, stale, future);
  }

  private TouchStatus statusFor(Facts facts) {
    for (StatusRule rule : statusRules) {
      if (rule.matches().test(facts)) {
        return rule.status();
      }
    }
    throw new IllegalStateException("status rules must end with a catch-all");
  }

  private record TierRule(int minScore, RiskTier tier) {}

  private record StatusRule(TouchStatus status, Predicate<Facts> matches) {}

  private record Facts(int cadenceDays, OptionalInt daysSinceTouch, OptionalInt dueInDays) {}
}
