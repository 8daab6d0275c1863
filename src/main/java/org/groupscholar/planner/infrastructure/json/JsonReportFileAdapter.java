package org.groupscholar.planner.infrastructure.json;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.groupscholar.planner.application.port.ReportOutputPort;
import org.groupscholar.planner.application.report.PlanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the full report as pretty-printed JSON to one file.
 * <p>The document is written to a sibling temporary file and moved into place, so readers never see a partial
 * report. Parent directories are created when missing.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportFileAdapter implements ReportOutputPort {
  private static final Logger log = LoggerFactory.getLogger(JsonReportFileAdapter.class);

  private final Path target;
  private final JsonReportWriter writer;

  /**
   * Creates an adapter writing to {@code target}.
   *
   * @param target JSON file path
   */
  public JsonReportFileAdapter(Path target) {
    this(target, new JsonReportWriter(true));
  }

  JsonReportFileAdapter(Path target, JsonReportWriter writer) {
    this.target = Objects.requireNonNull(target, "target").toAbsolutePath();
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  @Override
  public void write(PlanReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    Path parent = target.getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp)) {
        writer.write(report, out);
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.info("Wrote JSON report ({} actions) to {}", report.actions().size(), target);
  }
}
