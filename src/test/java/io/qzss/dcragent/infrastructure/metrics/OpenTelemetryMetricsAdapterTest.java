package io.qzss.dcragent.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("agent.dispatch.mail.delivered");
    adapter.increment("agent.dispatch.mail.delivered");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "agent.dispatch.mail.delivered");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("agent.dispatch.mail.delivered",
        point.getAttributes().get(AttributeKey.stringKey("agent.metric.key")));
    assertEquals("qzss-dcr-agent", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("agent.cache.evicted", 3);
    adapter.observe("agent.cache.evicted", 5);

    MetricData histogram = find(reader.collectAllMetrics(), "agent.cache.evicted");
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2, point.getCount());
    assertEquals(8.0, point.getSum());
  }

  @Test
  void sanitizeNameReplacesIllegalCharacters() {
    assertEquals("agent.dispatch.file_x.delivered",
        OpenTelemetryMetricsAdapter.sanitizeName("Agent.Dispatch.File x.Delivered"));
    assertEquals("m1st", OpenTelemetryMetricsAdapter.sanitizeName("1st"));
    assertEquals("agent.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
