package ca.gc.cra.seb.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code seb} command-line tool.
 * <p><strong>Why:</strong> Exam provisioning scripts branch on the outcome; a failed verification must be
 * distinguishable from a broken invocation.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** {@code verify} computed a different hash than the one received. */
  VERIFICATION_FAILED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading or writing a file failed. */
  IO_ERROR(3),
  /** The configuration was malformed or failed validation. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The {@code .seb} container was malformed, needed a password, or could not be decrypted. */
  CONTAINER_ERROR(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Numeric value handed to {@link System#exit(int)}.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
