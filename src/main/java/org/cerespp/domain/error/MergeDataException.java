package org.cerespp.domain.error;

/**
 * Describes one merged-spectrum sample that was excluded because none of its contributions carried a
 * usable flux and error.
 *
 * <p>Instances are collected by the merger rather than thrown out of it; the rest of the spectrum is
 * still produced.</p>
 *
 * @since 0.1.0
 */
public final class MergeDataException extends ActivityPipelineException {
  private static final long serialVersionUID = 1L;

  private final double wavelength;
  private final int contributions;

  /**
   * Creates the exception for the excluded sample.
   *
   * @param wavelength rest-frame wavelength of the sample in Angstrom
   * @param contributions number of orders that covered the sample
   */
  public MergeDataException(double wavelength, int contributions) {
    super("No usable flux/error at " + wavelength + " A across " + contributions + " order(s)");
    this.wavelength = wavelength;
    this.contributions = contributions;
  }

  /**
   * Returns the excluded wavelength.
   *
   * @return wavelength in Angstrom
   */
  public double wavelength() {
    return wavelength;
  }

  /**
   * Returns how many orders covered the excluded sample.
   *
   * @return contribution count
   */
  public int contributions() {
    return contributions;
  }
}
