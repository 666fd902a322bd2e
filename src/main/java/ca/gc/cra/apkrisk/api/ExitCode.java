package ca.gc.cra.apkrisk.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by APKRISK command-line tools.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points so automation can react to
 * outcomes without parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or the job file were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Scoring configuration (weights, caps, bands) was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The job failed because mandatory extractor data was missing. */
  ASSESSMENT_FAILED(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
