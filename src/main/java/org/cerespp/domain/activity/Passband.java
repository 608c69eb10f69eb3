package org.cerespp.domain.activity;

import java.util.Objects;

/**
 * A named wavelength band integrated by the index calculator.
 *
 * @param name label used in diagnostics, e.g. {@code CaK}
 * @param center band center in Angstrom
 * @param width full width (rectangular) or FWHM (triangular) in Angstrom
 * @param shape weighting profile
 * @since 0.1.0
 */
public record Passband(String name, double center, double width, WindowShape shape) {

  public Passband {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(shape, "shape");
    if (!(center > 0) || !(width > 0) || !Double.isFinite(center) || !Double.isFinite(width)) {
      throw new IllegalArgumentException("passband " + name + " needs a positive finite center and width");
    }
  }

  /** Rectangular band of full width {@code width}. */
  public static Passband rectangular(String name, double center, double width) {
    return new Passband(name, center, width, WindowShape.RECTANGULAR);
  }

  /** Triangular band of FWHM {@code fwhm}. */
  public static Passband triangular(String name, double center, double fwhm) {
    return new Passband(name, center, fwhm, WindowShape.TRIANGULAR);
  }

  /** @return lower edge of the non-zero support */
  public double lower() {
    return center - shape.halfSupport(width);
  }

  /** @return upper edge of the non-zero support */
  public double upper() {
    return center + shape.halfSupport(width);
  }

  /**
   * Weight of a pixel at {@code lambda}.
   *
   * @param lambda wavelength in Angstrom
   * @return weight in {@code [0, 1]}
   */
  public double weight(double lambda) {
    return shape.weight(lambda - center, width);
  }
}
