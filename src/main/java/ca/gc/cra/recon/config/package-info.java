/**
 * <strong>Purpose:</strong> Engine configuration: YAML loading, precedence merging, typed settings and
 * adapter wiring.
 * <p><strong>Precedence:</strong> CLI &gt; YAML &gt; embedded defaults.
 * <p><strong>Concurrency:</strong> Built once per CLI invocation on a single thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recon.config;
