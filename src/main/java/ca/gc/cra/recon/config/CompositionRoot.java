package ca.gc.cra.recon.config;

import ca.gc.cra.recon.application.port.ClockPort;
import ca.gc.cra.recon.application.port.HostMergePort;
import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.application.query.ActiveQueryService;
import ca.gc.cra.recon.application.query.PassiveQueryService;
import ca.gc.cra.recon.application.query.RecordQueryService;
import ca.gc.cra.recon.application.query.ScanResultService;
import ca.gc.cra.recon.application.query.ViewService;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import ca.gc.cra.recon.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.recon.infrastructure.store.JsonFileDocumentStore;
import ca.gc.cra.recon.validation.Paths;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires query services to JSON-file stores and the metrics adapter.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the CLI only deals with configuration.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the database directory and open one collection file per service.</li>
 *   <li>Create the metrics port named by {@link EngineConfig#metricsExporter()}.</li>
 *   <li>Release the metrics adapter on {@link #close()}; services are closed by their callers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not synchronized; build and use from the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final EngineConfig config;
  private final Path dbDir;
  private final MetricsPort metrics;
  private final OpenTelemetryMetricsAdapter metricsHandle;
  private final ClockPort clock;

  /**
   * Creates a root for one invocation.
   *
   * @param config effective configuration
   * @param createDb whether a missing database directory may be created
   * @throws IllegalArgumentException when the database directory is unusable
   */
  public CompositionRoot(EngineConfig config, boolean createDb) {
    this(config, createDb, ClockPort.SYSTEM);
  }

  CompositionRoot(EngineConfig config, boolean createDb, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.dbDir = Paths.validateDatabaseDir(config.dbPath(), createDb);
    if ("none".equals(config.metricsExporter())) {
      this.metrics = MetricsPort.NO_OP;
      this.metricsHandle = null;
    } else {
      OpenTelemetryMetricsAdapter adapter = OpenTelemetryMetricsAdapter.create(config.metricsExporter());
      this.metrics = adapter;
      this.metricsHandle = adapter;
    }
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return configuration
   */
  public EngineConfig config() {
    return config;
  }

  /**
   * Returns the metrics port shared by the services.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Opens the service of the configured collection.
   *
   * @return service; callers close it
   */
  public RecordQueryService service() {
    return "passive".equals(config.collection()) ? passiveService() : activeService();
  }

  /**
   * Opens the active service of the configured collection.
   *
   * @return scan-result service for {@code nmap}, view service for {@code view}
   * @throws IllegalStateException when the configured collection is {@code passive}
   */
  public ActiveQueryService activeService() {
    switch (config.collection()) {
      case "nmap":
        return new ScanResultService(
            () -> new JsonFileDocumentStore(dbDir, "hosts", FieldSchema.HOSTS),
            () -> new JsonFileDocumentStore(dbDir, "scans", FieldSchema.SCANS),
            metrics, clock);
      case "view":
        return new ViewService(
            () -> new JsonFileDocumentStore(dbDir, "views", FieldSchema.HOSTS),
            HostMergePort.NEVER, metrics, clock);
      default:
        throw new IllegalStateException("Collection " + config.collection() + " holds no host records");
    }
  }

  /**
   * Opens the passive service.
   *
   * @return passive service
   */
  public PassiveQueryService passiveService() {
    return new PassiveQueryService(
        () -> new JsonFileDocumentStore(dbDir, "passive", FieldSchema.PASSIVE), metrics, clock);
  }

  @Override
  public void close() {
    if (metricsHandle != null) {
      metricsHandle.close();
    }
  }
}
