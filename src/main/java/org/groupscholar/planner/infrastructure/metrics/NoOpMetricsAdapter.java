package org.groupscholar.planner.infrastructure.metrics;

import org.groupscholar.planner.application.port.MetricsPort;

/**
 * Metrics adapter used when {@code metricsExporter=none}; discards every update.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void add(String key, long amount) {}

  @Override
  public void observe(String key, long value) {}
}
