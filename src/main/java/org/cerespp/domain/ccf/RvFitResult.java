package org.cerespp.domain.ccf;

/**
 * Radial velocity and line-profile diagnostics derived from one CCF.
 *
 * @param rv fitted Gaussian center in km/s
 * @param rvError one-sigma uncertainty of {@code rv} from the fit covariance, km/s
 * @param bis bisector span in km/s measured on the raw profile; NaN when it could not be measured
 * @param fwhm full width at half maximum of the fitted Gaussian, km/s
 * @param fwhmError one-sigma uncertainty of {@code fwhm}, km/s
 * @param contrast fractional depth of the fitted Gaussian relative to its continuum
 * @param continuum fitted continuum level of the CCF
 * @param iterations optimizer iterations used
 * @since 0.1.0
 */
public record RvFitResult(
    double rv,
    double rvError,
    double bis,
    double fwhm,
    double fwhmError,
    double contrast,
    double continuum,
    int iterations) {

  /**
   * Tells whether the bisector span was measured.
   *
   * @return {@code true} when {@link #bis()} is finite
   */
  public boolean hasBis() {
    return Double.isFinite(bis);
  }
}
