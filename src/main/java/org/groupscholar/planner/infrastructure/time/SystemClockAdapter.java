package org.groupscholar.planner.infrastructure.time;

import org.groupscholar.planner.application.port.ClockPort;

/**
 * {@link ClockPort} backed by the system wall clock; the planner's source of {@code generatedAt} and the default
 * evaluation date.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
