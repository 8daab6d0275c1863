package org.groupscholar.planner.application.report;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Facts about one run: where the rows came from, the dates used, the configuration snapshot and row counts.
 *
 * @param source description of the record source
 * @param today date the run was evaluated against
 * @param generatedAt wall-clock instant the report was produced
 * @param config flat configuration snapshot
 * @param rowsRead raw rows read
 * @param scoredCount rows accepted and scored
 * @param rejectedCount rows excluded by normalization
 * @since 0.1.0
 */
public record RunMetadata(
    String source,
    LocalDate today,
    Instant generatedAt,
    Map<String, String> config,
    int rowsRead,
    int scoredCount,
    int rejectedCount) {

  public RunMetadata {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(today, "today");
    Objects.requireNonNull(generatedAt, "generatedAt");
    config = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(config, "config")));
    if (rowsRead < 0 || scoredCount < 0 || rejectedCount < 0) {
      throw new IllegalArgumentException("row counts must be non-negative");
    }
  }
}
