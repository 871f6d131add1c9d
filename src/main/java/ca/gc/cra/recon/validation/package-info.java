/**
 * <strong>Purpose:</strong> Input validators shared by the CLI and configuration layers.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}s that the CLI
 * maps to exit codes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recon.validation;
