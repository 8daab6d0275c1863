package org.groupscholar.planner.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("planner.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void countersAccumulateIncrementsAndAdds() {
    adapter.increment("plan.rows.read");
    adapter.add("plan.rows.read", 4);
    adapter.forceFlush();

    MetricData counter = metric("plan.rows.read").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(5L, point.getValue());
    assertEquals("plan.rows.read", point.getAttributes().get(KEY_ATTRIBUTE));
    assertEquals("intervention-planner",
        counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("org.groupscholar",
        counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observationsBecomeHistogramSamplesUnderSanitizedName() {
    adapter.observe("plan.latencyMillis", 10L);
    adapter.observe("plan.latencyMillis", 30L);
    adapter.forceFlush();

    MetricData histogram = metric("plan.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40.0, point.getSum());
    assertEquals("plan.latencyMillis", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void negativeCounterIncrementsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> adapter.add("plan.rows.read", -1));
  }

  @Test
  void sanitizeNameProducesInstrumentSafeNames() {
    assertEquals("plan.rows_read", OpenTelemetryMetricsAdapter.sanitizeName("Plan.Rows Read"));
    assertEquals("m1st.run", OpenTelemetryMetricsAdapter.sanitizeName("1st.run"));
    assertEquals("planner.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes(
        "deployment.environment=staging, broken, =x, team = outreach");

    assertEquals(2, attributes.size());
    assertEquals("staging", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("outreach", attributes.get(AttributeKey.stringKey("team")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes("").isEmpty());
  }

  private Optional<MetricData> metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst();
  }
}
