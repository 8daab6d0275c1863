package org.groupscholar.planner.application.normalize;

import static org.groupscholar.planner.testutil.Fixtures.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.groupscholar.planner.config.InvalidDatePolicy;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.RecordIssue;
import org.junit.jupiter.api.Test;

class RecordNormalizerTest {
  private final RecordNormalizer normalizer =
      new RecordNormalizer(HeaderAliases.standard(), InvalidDatePolicy.NEVER_TOUCHED);

  @Test
  void resolvesAliasesAndCanonicalizesValues() {
    NormalizationResult result = normalizer.normalize(List.of(row(1,
        "Scholar_ID", " S-1 ",
        "name", "Avery",
        "advisor", "Morgan",
        "preferred_channel", "Text",
        "last_contact", "03/01/2024",
        "risk", "72.5",
        "flags", "Housing; ;food")));

    assertEquals(1, result.records().size());
    NormalizedRecord record = result.records().get(0);
    assertEquals("S-1", record.id());
    assertEquals(Optional.of("Morgan"), record.owner());
    assertEquals("sms", record.channelPreference());
    assertEquals(Optional.of(LocalDate.of(2024, 3, 1)), record.lastTouchDate());
    assertEquals(73, record.riskScore());
    assertEquals(Set.of("housing", "food"), record.flags());
    assertTrue(result.issues().isEmpty());
  }

  @Test
  void missingRequiredFieldsRejectTheRow() {
    NormalizationResult result = normalizer.normalize(List.of(
        row(1, "id", "S-1", "name", "", "risk_score", "50"),
        row(2, "id", "S-2", "name", "Blake", "risk_score", "60")));

    assertEquals(2, result.rowsRead());
    assertEquals(1, result.rejectedRows());
    assertEquals("S-2", result.records().get(0).id());
    RecordIssue issue = result.issues().get(0);
    assertEquals(RecordIssue.Kind.MISSING_FIELD, issue.kind());
    assertEquals(HeaderAliases.NAME, issue.field());
    assertEquals(Optional.of("S-1"), issue.recordId());
    assertTrue(issue.excluded());
  }

  @Test
  void nonNumericRiskIsRejected() {
    NormalizationResult result = normalizer.normalize(List.of(row(4, "id", "S-1", "name", "A", "risk_score", "high")));

    assertEquals(0, result.records().size());
    assertEquals(RecordIssue.Kind.INVALID_SCORE, result.issues().get(0).kind());
    assertEquals(4, result.issues().get(0).rowNumber());
  }

  @Test
  void invalidDateIsTreatedAsNeverTouchedByDefault() {
    NormalizationResult result = normalizer.normalize(
        List.of(row(1, "id", "S-1", "name", "A", "risk_score", "50", "last_touch", "last spring")));

    assertEquals(1, result.records().size());
    assertTrue(result.records().get(0).lastTouchDate().isEmpty());
    RecordIssue issue = result.issues().get(0);
    assertEquals(RecordIssue.Kind.INVALID_DATE, issue.kind());
    assertFalse(issue.excluded());
  }

  @Test
  void invalidDateRejectsUnderRejectPolicy() {
    RecordNormalizer strict = new RecordNormalizer(HeaderAliases.standard(), InvalidDatePolicy.REJECT);

    NormalizationResult result = strict.normalize(
        List.of(row(1, "id", "S-1", "name", "A", "risk_score", "50", "last_touch", "2024-02-30")));

    assertEquals(0, result.records().size());
    assertEquals(1, result.rejectedRows());
    assertTrue(result.issues().get(0).excluded());
  }

  @Test
  void duplicateIdKeepsFirstOccurrence() {
    NormalizationResult result = normalizer.normalize(List.of(
        row(1, "id", "S-1", "name", "First", "risk_score", "50"),
        row(2, "id", "S-1", "name", "Second", "risk_score", "90")));

    assertEquals(1, result.records().size());
    assertEquals("First", result.records().get(0).name());
    assertEquals(RecordIssue.Kind.DUPLICATE_ID, result.issues().get(0).kind());
    assertEquals(2, result.issues().get(0).rowNumber());
  }

  @Test
  void riskScoresRoundHalfUpAndClamp() {
    assertEquals(0, RecordNormalizer.parseRiskScore("-4"));
    assertEquals(100, RecordNormalizer.parseRiskScore("140"));
    assertEquals(41, RecordNormalizer.parseRiskScore("40.5"));
    assertNull(RecordNormalizer.parseRiskScore("n/a"));
  }

  @Test
  void extremeExponentsClampWithoutFailingTheBatch() {
    assertEquals(100, RecordNormalizer.parseRiskScore("1e2147483647"));
    assertEquals(0, RecordNormalizer.parseRiskScore("1e-2147483647"));
    assertEquals(0, RecordNormalizer.parseRiskScore("-1e100000000"));

    NormalizationResult result = normalizer.normalize(List.of(
        row(1, "id", "A", "name", "Avery", "risk_score", "1e2147483647"),
        row(2, "id", "B", "name", "Blake", "risk_score", "50")));

    assertEquals(2, result.records().size());
    assertEquals(100, result.records().get(0).riskScore());
    assertEquals(50, result.records().get(1).riskScore());
    assertTrue(result.issues().isEmpty());
  }

  @Test
  void parsesSupportedDateFormats() {
    LocalDate expected = LocalDate.of(2024, 3, 9);
    assertEquals(Optional.of(expected), RecordNormalizer.parseDate("2024-03-09"));
    assertEquals(Optional.of(expected), RecordNormalizer.parseDate("03/09/2024"));
    assertEquals(Optional.of(expected), RecordNormalizer.parseDate("2024/03/09"));
    assertTrue(RecordNormalizer.parseDate("09.03.2024").isEmpty());
    assertTrue(RecordNormalizer.parseDate(" ").isEmpty());
  }

  @Test
  void channelAliasesCollapse() {
    assertEquals("call", RecordNormalizer.canonicalChannel("Phone"));
    assertEquals("sms", RecordNormalizer.canonicalChannel("text"));
    assertEquals("email", RecordNormalizer.canonicalChannel("Email"));
    assertEquals(RecordNormalizer.UNKNOWN_CHANNEL, RecordNormalizer.canonicalChannel(""));
  }
}
