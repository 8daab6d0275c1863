package org.groupscholar.planner.application.normalize;

import java.util.List;
import java.util.Objects;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.RecordIssue;

/**
 * Output of the normalizer: accepted records plus every issue found.
 *
 * @param rowsRead raw rows examined
 * @param records accepted records in source order
 * @param issues issues in source order; a row may carry several
 * @param rejectedRows rows excluded from scoring
 * @since 0.1.0
 */
public record NormalizationResult(
    int rowsRead, List<NormalizedRecord> records, List<RecordIssue> issues, int rejectedRows) {

  public NormalizationResult {
    records = List.copyOf(Objects.requireNonNull(records, "records"));
    issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
    if (records.size() + rejectedRows != rowsRead) {
      throw new IllegalArgumentException(
          "accepted (" + records.size() + ") plus rejected (" + rejectedRows + ") must equal rows read (" + rowsRead + ")");
    }
  }
}
