package ca.gc.cra.recon.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code recon} command line.
 * <p><strong>Why:</strong> Scripts chaining loads and queries need to tell bad arguments from IO
 * failures without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or filters were invalid. */
  INVALID_ARGS(2),
  /** Database directory, collection file or input file could not be read or written. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
