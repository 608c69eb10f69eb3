package org.cerespp.domain.error;

/**
 * Thrown when a mask identifier is not one of the supported line masks.
 *
 * <p>Raised while resolving configuration, before any correlation work starts.</p>
 *
 * @since 0.1.0
 */
public final class UnknownMaskException extends ActivityPipelineException {
  private static final long serialVersionUID = 1L;

  private final String requested;

  /**
   * Creates the exception for the rejected identifier.
   *
   * @param requested identifier as supplied by the caller; may be {@code null}
   */
  public UnknownMaskException(String requested) {
    super("Unknown mask '" + requested + "'; supported masks are G2, K0, K5, M2");
    this.requested = requested;
  }

  /**
   * Returns the identifier that failed to resolve.
   *
   * @return raw identifier, possibly {@code null}
   */
  public String requested() {
    return requested;
  }
}
