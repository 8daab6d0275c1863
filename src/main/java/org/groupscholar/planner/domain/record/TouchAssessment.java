package org.groupscholar.planner.domain.record;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Classifier output for one record: tier, cadence, due arithmetic and status.
 *
 * @param riskTier tier from the risk thresholds
 * @param cadenceDays target days between touches for the tier
 * @param daysSinceTouch whole days since last touch; empty when never touched
 * @param nextDueDate last touch plus cadence; empty when never touched
 * @param dueInDays days from today until the next due date; negative when overdue
 * @param status touch status
 * @param stale whether days since touch reached the stale threshold
 * @param futureTouchDate whether the source date lay after today and was clamped
 * @since 0.1.0
 */
public record TouchAssessment(
    RiskTier riskTier,
    int cadenceDays,
    OptionalInt daysSinceTouch,
    Optional<LocalDate> nextDueDate,
    OptionalInt dueInDays,
    TouchStatus status,
    boolean stale,
    boolean futureTouchDate) {

  public TouchAssessment {
    Objects.requireNonNull(riskTier, "riskTier");
    Objects.requireNonNull(daysSinceTouch, "daysSinceTouch");
    Objects.requireNonNull(nextDueDate, "nextDueDate");
    Objects.requireNonNull(dueInDays, "dueInDays");
    Objects.requireNonNull(status, "status");
  }
}
