package org.cerespp.api;

/**
 * Process exit codes returned by the {@code cerespp} commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command finished; in batch mode at least one input succeeded. */
  SUCCESS(0),
  /** Arguments, configuration values or mask id rejected. */
  INVALID_ARGS(2),
  /** An input spectrum or output file could not be read or written. */
  IO_ERROR(3),
  /** Configuration was accepted but could not be applied at run time. */
  CONFIG_ERROR(4),
  /** Processing failed (single file) or every batch input failed. */
  RUNTIME_FAILURE(5),
  /** Interrupted while waiting for batch workers. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric process status */
  public int code() {
    return code;
  }
}
