package org.cerespp.domain.error;

/**
 * Thrown when a non-finite or superluminal radial velocity reaches the rest-frame shift.
 *
 * @since 0.1.0
 */
public final class InvalidRvException extends ActivityPipelineException {
  private static final long serialVersionUID = 1L;

  private final double rv;

  /**
   * Creates the exception for the rejected velocity.
   *
   * @param rv offending radial velocity in km/s
   */
  public InvalidRvException(double rv) {
    super("Radial velocity must be finite and below the speed of light (was " + rv + " km/s)");
    this.rv = rv;
  }

  /**
   * Returns the rejected velocity.
   *
   * @return radial velocity in km/s
   */
  public double rv() {
    return rv;
  }
}
