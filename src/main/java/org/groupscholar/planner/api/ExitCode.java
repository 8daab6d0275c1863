package org.groupscholar.planner.api;

/**
 * Status codes the {@code plan} and {@code seed} commands hand back to the shell.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0),
  /** Bad {@code key=value} input, unknown option or inconsistent thresholds. */
  INVALID_ARGS(2),
  /** CSV, JSON report or database I/O failed. */
  IO_ERROR(3),
  /** Missing or unreadable YAML file, or database environment not set. */
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
