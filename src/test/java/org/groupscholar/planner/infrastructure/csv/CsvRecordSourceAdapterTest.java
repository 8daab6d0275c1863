package org.groupscholar.planner.infrastructure.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.groupscholar.planner.domain.record.RawRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvRecordSourceAdapterTest {
  @TempDir Path tempDir;

  @Test
  void readsHeaderKeyedRowsNumberedFromOne() throws IOException {
    List<RawRecord> rows = CsvRecordSourceAdapter.parse(new StringReader(
        "id,name,risk_score\nS-1,Avery,90\nS-2,Blake,40\n"));

    assertEquals(2, rows.size());
    assertEquals(1, rows.get(0).rowNumber());
    assertEquals(Map.of("id", "S-1", "name", "Avery", "risk_score", "90"), rows.get(0).values());
    assertEquals(2, rows.get(1).rowNumber());
  }

  @Test
  void skipsByteOrderMarkAndBlankRows() throws IOException {
    List<RawRecord> rows = CsvRecordSourceAdapter.parse(new StringReader(
        "\uFEFFid,name\nS-1,Avery\n\n,\nS-2,Blake\n"));

    assertEquals(2, rows.size());
    assertEquals("S-1", rows.get(0).values().get("id"));
    assertEquals(2, rows.get(1).rowNumber());
  }

  @Test
  void keepsQuotedCommasAndShortRows() throws IOException {
    List<RawRecord> rows = CsvRecordSourceAdapter.parse(new StringReader(
        "id,name,flags\nS-1,\"Lee, Avery\",\"crisis;food\"\nS-2,Blake\n"));

    assertEquals("Lee, Avery", rows.get(0).values().get("name"));
    assertEquals("crisis;food", rows.get(0).values().get("flags"));
    assertEquals(Map.of("id", "S-2", "name", "Blake"), rows.get(1).values());
  }

  @Test
  void emptyInputHasNoHeader() {
    IOException ex = assertThrows(IOException.class, () -> CsvRecordSourceAdapter.parse(new StringReader("")));
    assertTrue(ex.getMessage().contains("no header"));
  }

  @Test
  void unterminatedQuoteIsMalformed() {
    assertThrows(IOException.class, () -> CsvRecordSourceAdapter.parse(new StringReader(
        "id,name\nS-1,\"Avery\n")));
  }

  @Test
  void missingFileSurfacesAsIoException() {
    CsvRecordSourceAdapter source = new CsvRecordSourceAdapter(tempDir.resolve("absent.csv"));

    assertThrows(IOException.class, source::readAll);
  }

  @Test
  void readsSampleExportFromDisk() throws IOException {
    Path csv = tempDir.resolve("outreach.csv");
    try (InputStream in = getClass().getResourceAsStream("/fixtures/outreach.csv")) {
      Files.copy(in, csv);
    }
    CsvRecordSourceAdapter source = new CsvRecordSourceAdapter(csv);

    List<RawRecord> rows = source.readAll();

    assertEquals(12, rows.size());
    assertEquals("S-1001", rows.get(0).values().get("scholar_id"));
    assertEquals(csv.toString(), source.describe());
  }
}
