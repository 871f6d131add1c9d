package ca.gc.cra.recon.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter used by the query engine.
 *
 * <p>The exporter is chosen from the engine configuration first, then the {@code otel.metrics.exporter}
 * system property, then {@code OTEL_METRICS_EXPORTER}; {@code none} yields a no-op meter.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.recon";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final String VERSION_RESOURCE = "/META-INF/maven/ca.gc.cra/recon/pom.properties";

  private OpenTelemetryBootstrap() {
    // Utility
  }

  /**
   * Creates the meter for the configured exporter; failures fall back to a no-op meter.
   *
   * @param configuredExporter exporter name from the engine configuration, or {@code null}
   * @return bootstrap result owning the meter provider
   */
  static Meters initialize(String configuredExporter) {
    String exporter = firstNonBlank(configuredExporter,
        System.getProperty("otel.metrics.exporter"),
        System.getenv("OTEL_METRICS_EXPORTER"),
        "otlp");
    try {
      if (ExporterMode.from(exporter) == ExporterMode.NONE) {
        log.info("Metrics export disabled (exporter=none)");
        return Meters.noop();
      }
      String endpoint = firstNonBlank(System.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      log.info("Metrics exported over OTLP to {}", endpoint);
      return withReader(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop meter", ex);
      return Meters.noop();
    }
  }

  /**
   * Creates a meter whose data is collected by {@code reader}.
   *
   * @param reader metric reader, typically an in-memory reader in tests
   * @return bootstrap result
   */
  static Meters withReader(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new Meters(meter, provider);
  }

  private static Resource resource(String version) {
    Attributes attributes = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "recon")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(AttributeKey.stringKey("service.instance.id"), String.valueOf(ProcessHandle.current().pid()))
        .build();
    return Resource.getDefault().merge(Resource.create(attributes));
  }

  static String serviceVersion() {
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(VERSION_RESOURCE)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read {} for version detection", VERSION_RESOURCE, ex);
    }
    return "0.0.0-dev";
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return null;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw == null ? "otlp" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; defaulting to otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  /** Meter plus the provider that must be shut down with it. */
  static final class Meters implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Meters(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Meters noop() {
      return new Meters(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
          log.warn("Metrics flush did not complete within timeout");
        }
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        CompletableResultCode result = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
          log.warn("Timed out waiting for the meter provider to shut down");
        }
      }
    }
  }
}
