package org.groupscholar.planner.application.port;

/**
 * <strong>What:</strong> Port abstracting planner metrics emission.
 * <p><strong>Why:</strong> Lets the use case count records and time runs without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract, for example {@code planner.records.scored}
 * and {@code planner.run.latencyMillis}.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Increments the named counter by {@code amount}.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param amount non-negative increment
   */
  void add(String key, long amount);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void add(String key, long amount) {}

    @Override public void observe(String key, long value) {}
  };
}
