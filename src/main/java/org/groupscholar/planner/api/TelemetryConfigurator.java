package org.groupscholar.planner.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.groupscholar.planner.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies the metrics settings of a run into the {@code otel.*} system properties read by the OpenTelemetry
 * bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Validates and applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param settings merged settings
   * @return {@code true} when the OTLP exporter was selected
   * @throws IllegalArgumentException when a value is invalid
   */
  static boolean configureMetrics(Map<String, String> settings) {
    String exporter = settings.getOrDefault("metricsExporter", "none").trim().toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "none";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", exporter);

    String endpoint = settings.getOrDefault("otelEndpoint", "").trim();
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = settings.getOrDefault("otelResourceAttributes", "").trim();
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    return exporter.equals("otlp");
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
