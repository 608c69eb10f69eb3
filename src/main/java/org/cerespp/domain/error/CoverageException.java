package org.cerespp.domain.error;

/**
 * Thrown when an activity index cannot be computed because one of its bands lacks usable data.
 *
 * <p>Only the affected index is dropped; the calculator keeps the exception as the recorded reason.</p>
 *
 * @since 0.1.0
 */
public final class CoverageException extends ActivityPipelineException {
  private static final long serialVersionUID = 1L;

  private final String index;
  private final String band;

  /**
   * Creates the exception.
   *
   * @param index index name that failed (for example {@code HeI})
   * @param band band label that was not covered
   * @param detail short description of the gap
   */
  public CoverageException(String index, String band, String detail) {
    super("Index " + index + " unavailable: band " + band + " " + detail);
    this.index = index;
    this.band = band;
  }

  /**
   * Returns the index that could not be computed.
   *
   * @return index name
   */
  public String index() {
    return index;
  }

  /**
   * Returns the band label that lacked coverage.
   *
   * @return band label
   */
  public String band() {
    return band;
  }
}
