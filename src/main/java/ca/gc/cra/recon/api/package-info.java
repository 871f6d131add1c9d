/**
 * <strong>Purpose:</strong> Command-line adapter: argument parsing, filter mapping, JSON-lines output and
 * exit codes.
 * <p><strong>Concurrency:</strong> One command per process on the main thread.
 * <p><strong>Observability:</strong> Lifecycle at INFO, failures at ERROR; results go to stdout, logs to stderr.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recon.api;
