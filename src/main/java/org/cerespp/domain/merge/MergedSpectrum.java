package org.cerespp.domain.merge;

import java.util.Arrays;

/**
 * <strong>What:</strong> Single 1-D rest-frame spectrum produced by merging echelle orders.
 * <p><strong>Role:</strong> Input to the activity index calculator and the optional 1-D FITS artifact.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied on construction and on access.</p>
 *
 * @param wavelength strictly increasing wavelengths in Angstrom, no duplicates
 * @param flux merged flux per sample
 * @param error one-sigma merged error per sample
 * @param signalToNoise median flux over median error
 * @since 0.1.0
 */
public record MergedSpectrum(double[] wavelength, double[] flux, double[] error, double signalToNoise) {

  /**
   * Validates and copies the samples.
   *
   * @throws IllegalArgumentException if the arrays differ in length or the wavelengths are not strictly
   *     increasing
   */
  public MergedSpectrum {
    if (wavelength == null || flux == null || error == null) {
      throw new IllegalArgumentException("merged spectrum requires wavelength, flux and error arrays");
    }
    if (wavelength.length != flux.length || wavelength.length != error.length) {
      throw new IllegalArgumentException("merged spectrum arrays differ in length");
    }
    for (int i = 1; i < wavelength.length; i++) {
      if (!(wavelength[i] > wavelength[i - 1])) {
        throw new IllegalArgumentException("merged wavelengths must be strictly increasing at sample " + i);
      }
    }
    wavelength = wavelength.clone();
    flux = flux.clone();
    error = error.clone();
  }

  @Override
  public double[] wavelength() {
    return wavelength.clone();
  }

  @Override
  public double[] flux() {
    return flux.clone();
  }

  @Override
  public double[] error() {
    return error.clone();
  }

  public int size() {
    return wavelength.length;
  }

  public double wavelengthAt(int i) {
    return wavelength[i];
  }

  public double fluxAt(int i) {
    return flux[i];
  }

  public double errorAt(int i) {
    return error[i];
  }

  /**
   * Tests whether the spectrum spans {@code [from, to]} entirely.
   *
   * @param from lower wavelength in Angstrom
   * @param to upper wavelength in Angstrom
   * @return {@code true} when both ends are inside the sampled range
   */
  public boolean spans(double from, double to) {
    return wavelength.length > 0 && from >= wavelength[0] && to <= wavelength[wavelength.length - 1];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MergedSpectrum that)) {
      return false;
    }
    return Double.compare(signalToNoise, that.signalToNoise) == 0
        && Arrays.equals(wavelength, that.wavelength)
        && Arrays.equals(flux, that.flux)
        && Arrays.equals(error, that.error);
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(signalToNoise);
    result = 31 * result + Arrays.hashCode(wavelength);
    result = 31 * result + Arrays.hashCode(flux);
    result = 31 * result + Arrays.hashCode(error);
    return result;
  }

  @Override
  public String toString() {
    return "MergedSpectrum{samples=" + wavelength.length + ", snr=" + signalToNoise + '}';
  }
}
