package org.groupscholar.planner.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider from {@code otel.*} system properties, falling back to the standard
 * {@code OTEL_*} environment variables. Exporting is off unless the exporter is {@code otlp}.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "org.groupscholar.planner";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final String SERVICE_VERSION_FALLBACK = "0.0.0-dev";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    try {
      String exporter = firstNonBlank(
          System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "none");
      if (!"otlp".equals(exporter.toLowerCase(Locale.ROOT))) {
        log.info("OpenTelemetry metrics exporter disabled (exporter={})", exporter);
        return BootstrapResult.noop();
      }
      String endpoint = firstNonBlank(
          System.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      String attributes = firstNonBlank(
          System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(Duration.ofSeconds(30))
          .build();
      BootstrapResult result = build(reader, parseResourceAttributes(attributes));
      log.info("OpenTelemetry metrics initialized with OTLP exporter targeting {}", endpoint);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extra) {
    String version = detectServiceVersion();
    Resource base = Resource.create(Attributes.builder()
        .put(SERVICE_NAME, "intervention-planner")
        .put(SERVICE_NAMESPACE, "org.groupscholar")
        .put(SERVICE_VERSION, version)
        .build());
    Resource resource = Resource.getDefault().merge(base)
        .merge(extra.isEmpty() ? Resource.empty() : Resource.create(extra));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      int idx = trimmed.indexOf('=');
      if (trimmed.isEmpty()) {
        continue;
      }
      if (idx <= 0 || idx == trimmed.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? SERVICE_VERSION_FALLBACK : version;
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown();
      shutdown.join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
