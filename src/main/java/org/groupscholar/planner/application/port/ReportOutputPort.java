package org.groupscholar.planner.application.port;

import org.groupscholar.planner.application.report.PlanReport;

/**
 * <strong>What:</strong> Destination for an assembled plan report.
 * <p><strong>Why:</strong> Decouples report assembly from delivery so adapters can target the console, a JSON
 * file or the relational run store.</p>
 * <p><strong>Thread-safety:</strong> Implementations expect single-threaded use.</p>
 *
 * @implNote Extends {@link AutoCloseable} so callers can flush and release resources deterministically.
 * @since 0.1.0
 */
public interface ReportOutputPort extends AutoCloseable {
  /**
   * Writes the report.
   *
   * @param report assembled report; must not be {@code null}
   * @throws Exception if writing fails or the sink rejects the report
   */
  void write(PlanReport report) throws Exception;

  /**
   * Closes the output and flushes buffered data.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
