package ca.gc.cra.recon.application.port;

/**
 * <strong>What:</strong> Domain port abstracting query engine metrics emission.
 * <p><strong>Why:</strong> Lets query services count calls and time aggregations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like queries served or passive records folded.</li>
 *   <li>Record numeric observations such as aggregation latency.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code recon.passive.merge.folded}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code recon.hosts.get}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
