package ca.gc.cra.recon.application.port;

/**
 * <strong>What:</strong> Domain port supplying wall-clock time to relative time searches.
 * <p><strong>Why:</strong> "Seen in the last N seconds" filters depend on the current time; tests inject a fixed
 * clock instead.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
