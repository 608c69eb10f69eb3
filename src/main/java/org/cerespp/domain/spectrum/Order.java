package org.cerespp.domain.spectrum;

import java.util.Arrays;

/**
 * <strong>What:</strong> One echelle diffraction order: parallel wavelength, flux and flux-error samples.
 * <p><strong>Why:</strong> Keeps the per-order sampling intact through correlation, rest-frame shifting and merging.</p>
 * <p><strong>Role:</strong> Domain value produced by {@code SpectrumSource} adapters and consumed by the numeric core.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied on construction and on access.</p>
 * <p><strong>Performance:</strong> Hot loops should use the indexed accessors instead of the array copies.</p>
 *
 * @param index order number as reported by the reduction (informational)
 * @param wavelength strictly increasing wavelengths in Angstrom
 * @param flux flux per pixel; same length as {@code wavelength}
 * @param error one-sigma flux error per pixel; non-negative or NaN when unknown
 * @since 0.1.0
 */
public record Order(int index, double[] wavelength, double[] flux, double[] error) {

  /**
   * Validates the sampling invariants and copies the arrays.
   *
   * @throws IllegalArgumentException if lengths differ, fewer than two pixels are present, wavelengths
   *     are not strictly increasing or an error is negative
   */
  public Order {
    if (wavelength == null || flux == null || error == null) {
      throw new IllegalArgumentException("order " + index + " requires wavelength, flux and error arrays");
    }
    if (wavelength.length != flux.length || wavelength.length != error.length) {
      throw new IllegalArgumentException(
          "order " + index + " arrays differ in length (" + wavelength.length + ", " + flux.length + ", "
              + error.length + ")");
    }
    if (wavelength.length < 2) {
      throw new IllegalArgumentException("order " + index + " must contain at least two pixels");
    }
    for (int i = 1; i < wavelength.length; i++) {
      if (!(wavelength[i] > wavelength[i - 1])) {
        throw new IllegalArgumentException(
            "order " + index + " wavelengths must be strictly increasing at pixel " + i);
      }
    }
    for (int i = 0; i < error.length; i++) {
      if (error[i] < 0) {
        throw new IllegalArgumentException("order " + index + " has a negative error at pixel " + i);
      }
    }
    wavelength = wavelength.clone();
    flux = flux.clone();
    error = error.clone();
  }

  /**
   * Returns a copy of the wavelength samples.
   *
   * @return wavelengths in Angstrom
   */
  @Override
  public double[] wavelength() {
    return wavelength.clone();
  }

  /**
   * Returns a copy of the flux samples.
   *
   * @return flux values
   */
  @Override
  public double[] flux() {
    return flux.clone();
  }

  /**
   * Returns a copy of the error samples.
   *
   * @return one-sigma errors
   */
  @Override
  public double[] error() {
    return error.clone();
  }

  /** @return number of pixels */
  public int size() {
    return wavelength.length;
  }

  /** @return wavelength of pixel {@code i} */
  public double wavelengthAt(int i) {
    return wavelength[i];
  }

  /** @return flux of pixel {@code i} */
  public double fluxAt(int i) {
    return flux[i];
  }

  /** @return error of pixel {@code i} */
  public double errorAt(int i) {
    return error[i];
  }

  /** @return first (bluest) wavelength */
  public double minWavelength() {
    return wavelength[0];
  }

  /** @return last (reddest) wavelength */
  public double maxWavelength() {
    return wavelength[wavelength.length - 1];
  }

  /**
   * Tests whether {@code lambda} lies inside the order span, edges included.
   *
   * @param lambda wavelength in Angstrom
   * @return {@code true} when covered
   */
  public boolean covers(double lambda) {
    return lambda >= wavelength[0] && lambda <= wavelength[wavelength.length - 1];
  }

  /**
   * Index of the last pixel whose wavelength is less than or equal to {@code lambda}.
   *
   * @param lambda wavelength inside the order span
   * @return left neighbour index, clamped to {@code [0, size - 2]}
   */
  public int leftIndex(double lambda) {
    int pos = Arrays.binarySearch(wavelength, lambda);
    int left = pos >= 0 ? pos : -pos - 2;
    return Math.max(0, Math.min(left, wavelength.length - 2));
  }

  /**
   * Linearly interpolates the flux at {@code lambda}.
   *
   * @param lambda wavelength inside the order span
   * @return interpolated flux, or the exact sample when {@code lambda} hits a pixel
   */
  public double interpolateFlux(double lambda) {
    return interpolate(flux, lambda);
  }

  /**
   * Linearly interpolates the error at {@code lambda}.
   *
   * @param lambda wavelength inside the order span
   * @return interpolated error, or the exact sample when {@code lambda} hits a pixel
   */
  public double interpolateError(double lambda) {
    return interpolate(error, lambda);
  }

  /**
   * Returns a copy of this order with a new wavelength axis and the same flux and error.
   *
   * @param newWavelength replacement wavelengths
   * @return new order
   */
  public Order withWavelength(double[] newWavelength) {
    return new Order(index, newWavelength, flux, error);
  }

  private double interpolate(double[] values, double lambda) {
    int pos = Arrays.binarySearch(wavelength, lambda);
    if (pos >= 0) {
      return values[pos];
    }
    int left = leftIndex(lambda);
    double x0 = wavelength[left];
    double x1 = wavelength[left + 1];
    double t = (lambda - x0) / (x1 - x0);
    return values[left] + t * (values[left + 1] - values[left]);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Order that)) {
      return false;
    }
    return index == that.index
        && Arrays.equals(wavelength, that.wavelength)
        && Arrays.equals(flux, that.flux)
        && Arrays.equals(error, that.error);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(index);
    result = 31 * result + Arrays.hashCode(wavelength);
    result = 31 * result + Arrays.hashCode(flux);
    result = 31 * result + Arrays.hashCode(error);
    return result;
  }

  @Override
  public String toString() {
    return "Order{index=" + index
        + ", pixels=" + wavelength.length
        + ", range=" + wavelength[0] + ".." + wavelength[wavelength.length - 1]
        + '}';
  }
}
