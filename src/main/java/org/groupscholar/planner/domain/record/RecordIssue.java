package org.groupscholar.planner.domain.record;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-row normalization problem collected into the run-level issue list.
 *
 * @param rowNumber source row number
 * @param recordId record identifier when it could be read
 * @param kind problem classification
 * @param field canonical field name involved
 * @param message operator-facing description
 * @param excluded whether the row was dropped from scoring
 * @since 0.1.0
 */
public record RecordIssue(
    int rowNumber,
    Optional<String> recordId,
    Kind kind,
    String field,
    String message,
    boolean excluded) {

  public RecordIssue {
    recordId = recordId == null ? Optional.empty() : recordId;
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(message, "message");
  }

  /** Classification of normalization problems. */
  public enum Kind {
    /** A required field is absent or blank. */
    MISSING_FIELD,
    /** A date could not be parsed. */
    INVALID_DATE,
    /** The risk score is not numeric. */
    INVALID_SCORE,
    /** The identifier repeats an earlier row. */
    DUPLICATE_ID
  }
}
