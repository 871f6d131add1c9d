package ca.gc.cra.recon.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.*;

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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("recon.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = OpenTelemetryMetricsAdapter.forReader(reader);
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }

  @Test
  void incrementExportsCounterWithKeyAttribute() {
    adapter.increment("recon.hosts.get");
    adapter.increment("recon.hosts.get");
    adapter.forceFlush();

    MetricData counter = metric("recon.hosts.get");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("recon.hosts.get", point.getAttributes().get(METRIC_KEY));
    assertEquals("recon", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("recon.hosts.topvalues.latencyNanos", 1_000L);
    adapter.observe("recon.hosts.topvalues.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = metric("recon.hosts.topvalues.latencynanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
    assertEquals("recon.hosts.topvalues.latencyNanos", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("recon.passive.merge.created", OpenTelemetryMetricsAdapter.instrumentName("recon.passive.merge.created"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.instrumentName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.instrumentName("A b"));
    assertEquals("recon.metric", OpenTelemetryMetricsAdapter.instrumentName("  "));
  }

  @Test
  void exporterNoneRunsWithoutProvider() {
    try (OpenTelemetryMetricsAdapter noop = OpenTelemetryMetricsAdapter.create("none")) {
      noop.increment("recon.hosts.get");
      noop.observe("recon.hosts.topvalues.latencyNanos", 5L);
    }
    assertTrue(OpenTelemetryBootstrap.initialize("none").isNoop());
  }
}
