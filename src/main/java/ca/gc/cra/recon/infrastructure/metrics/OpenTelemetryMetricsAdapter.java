package ca.gc.cra.recon.infrastructure.metrics;

import ca.gc.cra.recon.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Role:</strong> Infrastructure adapter wired by the CLI when metrics are enabled.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one instrument per metric key on first use and reuse it afterwards.</li>
 *   <li>Tag every data point with the original key under {@code recon.metric.key}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instrument caches are concurrent maps.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("recon.metric.key");

  private final OpenTelemetryBootstrap.Meters meters;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  private OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Meters meters) {
    this.meters = Objects.requireNonNull(meters, "meters");
    this.meter = meters.meter();
    if (meters.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  /**
   * Creates an adapter for the configured exporter.
   *
   * @param exporter {@code otlp}, {@code none}, or {@code null} to use the environment
   * @return adapter
   */
  public static OpenTelemetryMetricsAdapter create(String exporter) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize(exporter));
  }

  static OpenTelemetryMetricsAdapter forReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.withReader(reader));
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, k -> meter.counterBuilder(instrumentName(k))
            .setUnit("1")
            .setDescription("Recon counter for " + k)
            .build())
        .add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, k -> meter.histogramBuilder(instrumentName(k))
            .ofLongs()
            .setDescription("Recon observation for " + k)
            .build())
        .record(value, Attributes.of(METRIC_KEY, key));
  }

  void forceFlush() {
    meters.forceFlush();
  }

  @Override
  public void close() {
    meters.close();
  }

  /**
   * Maps a metric key onto the OpenTelemetry instrument name syntax.
   *
   * @param key metric key such as {@code recon.hosts.get}
   * @return lower-case name starting with a letter, other characters replaced by {@code _}
   */
  static String instrumentName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return "recon.metric";
    }
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (char c : lower.toCharArray()) {
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString();
  }
}
