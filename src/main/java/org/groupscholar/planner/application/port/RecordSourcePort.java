package org.groupscholar.planner.application.port;

import java.io.IOException;
import java.util.List;
import org.groupscholar.planner.domain.record.RawRecord;

/**
 * <strong>What:</strong> Source of raw outreach rows for one run.
 * <p><strong>Why:</strong> Keeps the engine free of file formats; the CSV adapter is one implementation.</p>
 * <p><strong>Contract:</strong> Rows are returned in source order with 1-based row numbers counting data rows
 * only. Header names are passed through untouched; alias resolution is the normalizer's job.</p>
 *
 * @since 0.1.0
 */
public interface RecordSourcePort {
  /**
   * Reads every row.
   *
   * @return rows in source order
   * @throws IOException when the source cannot be read or is structurally malformed
   */
  List<RawRecord> readAll() throws IOException;

  /**
   * Returns a short description of the source for logs and run metadata.
   *
   * @return source label, such as a file path
   */
  String describe();
}
