package org.groupscholar.planner.infrastructure.csv;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.groupscholar.planner.application.port.RecordSourcePort;
import org.groupscholar.planner.domain.record.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads outreach rows from a UTF-8 CSV file with a header row.
 * <p><strong>Format:</strong> Comma separated, RFC 4180 quoting, optional byte-order mark. Blank lines and rows
 * whose cells are all blank are skipped; short rows yield only the cells present. Values are passed through as
 * strings.</p>
 * <p><strong>Errors:</strong> Missing files, a missing header row and malformed quoting surface as
 * {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public final class CsvRecordSourceAdapter implements RecordSourcePort {
  private static final Logger log = LoggerFactory.getLogger(CsvRecordSourceAdapter.class);
  private static final char BOM = '\uFEFF';

  private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
      .setHeader()
      .setSkipHeaderRecord(true)
      .setIgnoreEmptyLines(true)
      .setAllowMissingColumnNames(true)
      .build();

  private final Path path;

  /**
   * Creates a source for one file.
   *
   * @param path CSV file
   */
  public CsvRecordSourceAdapter(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public List<RawRecord> readAll() throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader);
    }
  }

  @Override
  public String describe() {
    return path.toString();
  }

  /**
   * Parses CSV text from any reader and closes it.
   *
   * @param reader character source
   * @return rows in source order, numbered from 1
   * @throws IOException when the header is missing or the text is malformed
   */
  static List<RawRecord> parse(Reader reader) throws IOException {
    BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    skipByteOrderMark(buffered);
    List<RawRecord> rows = new ArrayList<>();
    try (CSVParser parser = FORMAT.parse(buffered)) {
      List<String> headers = parser.getHeaderNames();
      if (headers.isEmpty()) {
        throw new IOException("CSV input has no header row");
      }
      for (CSVRecord record : parser) {
        Map<String, String> values = new LinkedHashMap<>();
        boolean blank = true;
        for (int i = 0; i < Math.min(headers.size(), record.size()); i++) {
          String value = record.get(i);
          String header = headers.get(i);
          if (header != null && !header.isEmpty()) {
            values.putIfAbsent(header, value);
          }
          if (value != null && !value.isBlank()) {
            blank = false;
          }
        }
        if (blank) {
          log.debug("Skipping blank CSV line {}", record.getRecordNumber());
          continue;
        }
        rows.add(new RawRecord(rows.size() + 1, values));
      }
      log.debug("Parsed {} CSV rows with headers {}", rows.size(), headers);
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    } catch (IllegalStateException ex) {
      throw new IOException("Malformed CSV input: " + ex.getMessage(), ex);
    }
    return rows;
  }

  private static void skipByteOrderMark(BufferedReader reader) throws IOException {
    reader.mark(1);
    int first = reader.read();
    if (first != BOM) {
      reader.reset();
    }
  }
}
