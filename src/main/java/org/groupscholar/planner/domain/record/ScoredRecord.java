package org.groupscholar.planner.domain.record;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> A normalized record with its touch assessment, priority score and explanation.
 * <p><strong>Role:</strong> Read-only input to every aggregation stage.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param record normalized input record
 * @param assessment classifier output
 * @param priorityScore non-negative score rounded to two decimals
 * @param priorityReasons ordered reasons; empty unless explain mode was requested
 * @param recommendedAction suggested outreach phrase
 * @since 0.1.0
 */
public record ScoredRecord(
    NormalizedRecord record,
    TouchAssessment assessment,
    double priorityScore,
    List<String> priorityReasons,
    String recommendedAction) {

  public ScoredRecord {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(assessment, "assessment");
    if (priorityScore < 0 || Double.isNaN(priorityScore)) {
      throw new IllegalArgumentException("priorityScore must be non-negative (was " + priorityScore + ")");
    }
    priorityReasons = priorityReasons == null ? List.of() : List.copyOf(priorityReasons);
    recommendedAction = recommendedAction == null ? "" : recommendedAction;
  }

  public String id() {
    return record.id();
  }

  public RiskTier tier() {
    return assessment.riskTier();
  }

  public TouchStatus status() {
    return assessment.status();
  }

  public boolean stale() {
    return assessment.stale();
  }

  public OptionalInt dueInDays() {
    return assessment.dueInDays();
  }

  public String owner() {
    return record.ownerOrUnassigned();
  }
}
