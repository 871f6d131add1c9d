/**
 * Logging helpers: CLI verbosity toggle and bounded quoting of record values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recon.logging;
