package org.cerespp.domain.error;

/**
 * Base type for failures raised by the activity numeric core.
 *
 * <p>Every subtype identifies how far the failure reaches: a single wavelength sample, a single index,
 * or the whole observation. Callers branch on the subtype rather than on messages.</p>
 *
 * @since 0.1.0
 */
public abstract class ActivityPipelineException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  protected ActivityPipelineException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause, typically from the optimizer
   */
  protected ActivityPipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
