package org.groupscholar.planner.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.groupscholar.planner.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Forwards planner counters and histograms to an OpenTelemetry meter.
 * <p><strong>Naming:</strong> Keys are lower-cased and characters outside {@code [a-z0-9._-]} become
 * {@code _}; the original key is kept as the {@code planner.metric.key} attribute.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} flushes and shuts the meter provider down; call it once the run
 * has finished so the last counters are exported.</p>
 * <p><strong>Thread-safety:</strong> Instruments are cached in concurrent maps.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("planner.metric.key");
  private static final String FALLBACK_METRIC_NAME = "planner.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter wired to the exporter selected through system properties or the environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    add(key, 1L);
  }

  @Override
  public void add(String key, long amount) {
    Objects.requireNonNull(key, "key");
    if (amount < 0) {
      throw new IllegalArgumentException("counter increment must be non-negative (was " + amount + ")");
    }
    Instrument<LongCounter> instrument = counters.computeIfAbsent(key, this::createCounter);
    instrument.value().add(amount, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(key, this::createHistogram);
    instrument.value().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Planner counter for " + key)
        .build();
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("Planner observation for " + key)
        .build();
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Instrument<T>(T value, Attributes attributes) {}
}
