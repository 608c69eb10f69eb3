package org.cerespp.domain.activity;

/**
 * Weighting profile of a passband.
 *
 * @since 0.1.0
 */
public enum WindowShape {
  /** Unit weight across {@code |lambda - center| <= width / 2}. */
  RECTANGULAR {
    @Override
    public double weight(double offset, double width) {
      return Math.abs(offset) <= width / 2.0 ? 1.0 : 0.0;
    }

    @Override
    public double halfSupport(double width) {
      return width / 2.0;
    }
  },

  /** Weight {@code 1 - |lambda - center| / width} where positive; {@code width} is the FWHM. */
  TRIANGULAR {
    @Override
    public double weight(double offset, double width) {
      double d = Math.abs(offset);
      return d < width ? 1.0 - d / width : 0.0;
    }

    @Override
    public double halfSupport(double width) {
      return width;
    }
  };

  /**
   * Weight at {@code offset} from the band center.
   *
   * @param offset wavelength offset in Angstrom
   * @param width band width parameter in Angstrom
   * @return weight in {@code [0, 1]}
   */
  public abstract double weight(double offset, double width);

  /**
   * Distance from the center to the edge of the non-zero support.
   *
   * @param width band width parameter in Angstrom
   * @return half support in Angstrom
   */
  public abstract double halfSupport(double width);
}
