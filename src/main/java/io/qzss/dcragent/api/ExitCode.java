package io.qzss.dcragent.api;

/**
 * <strong>What:</strong> Process exit statuses of the agent.
 * <p><strong>Why:</strong> Init scripts and supervisors tell startup misconfiguration, spawn failure and signal
 * termination apart by status alone.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including {@code --help} and {@code --dry-run}. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was malformed or named unknown locality keywords. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The producer subprocess could not be started at all. */
  SPAWN_FAILURE(6),
  /** Interrupted before the supervisor started. */
  INTERRUPTED(130),
  /** Stopped by a termination signal after the cache dump. */
  TERMINATED(143);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
