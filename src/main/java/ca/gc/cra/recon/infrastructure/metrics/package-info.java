/**
 * Metrics adapters bridging {@link ca.gc.cra.recon.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes {@code recon.<collection>.get},
 * {@code recon.<collection>.topvalues.latencyNanos} and {@code recon.passive.merge.*}.</p>
 * <p><strong>Security:</strong> Only metric names and counts are exported, never record contents.</p>
 */
package ca.gc.cra.recon.infrastructure.metrics;
