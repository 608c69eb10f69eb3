package org.cerespp.domain.error;

/**
 * Thrown when the CCF peak fit cannot produce a radial velocity.
 *
 * <p>Covers both an exhausted iteration budget and a fit window with too few valid samples. Fatal for
 * the observation being processed, never for its siblings in a batch.</p>
 *
 * @since 0.1.0
 */
public final class ConvergenceException extends ActivityPipelineException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ConvergenceException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping the optimizer failure.
   *
   * @param message human-readable error
   * @param cause optimizer exception
   */
  public ConvergenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
