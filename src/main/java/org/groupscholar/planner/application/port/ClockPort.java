package org.groupscholar.planner.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the planner use case.
 * <p><strong>Why:</strong> The report's {@code generatedAt} and the default "today" come from here, so tests can
 * pin both and get identical reports run after run.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see org.groupscholar.planner.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
