package ca.gc.cra.helio.api;

/**
 * <strong>What:</strong> Process exit codes returned by the HELIO command-line tools.
 * <p><strong>Why:</strong> Schedulers that run {@code helio acquire} periodically branch on these values, e.g. to
 * retry after {@link #ACQUISITION_FAILED} but alert on {@link #CONFIG_ERROR}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading or writing a file failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** No usable batch: the reference or single channel failed, nothing was acquired, or assembly was refused. */
  ACQUISITION_FAILED(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
