package org.groupscholar.planner.domain.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Untyped input row as delivered by a record source: header to cell value.
 *
 * @param rowNumber 1-based data row number (header excluded) used in diagnostics
 * @param values header to raw cell value; header case is preserved as read
 * @since 0.1.0
 */
public record RawRecord(int rowNumber, Map<String, String> values) {

  public RawRecord {
    if (rowNumber < 1) {
      throw new IllegalArgumentException("rowNumber must be >= 1 (was " + rowNumber + ")");
    }
    Objects.requireNonNull(values, "values");
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
