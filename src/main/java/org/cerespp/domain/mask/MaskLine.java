package org.cerespp.domain.mask;

/**
 * Rest-frame line center and its correlation weight.
 *
 * @param center line center in Angstrom (air)
 * @param weight positive correlation weight, usually the relative line depth
 * @since 0.1.0
 */
public record MaskLine(double center, double weight) {

  /**
   * Validates the line.
   *
   * @throws IllegalArgumentException if the center is not positive or the weight is not positive
   */
  public MaskLine {
    if (!(center > 0) || !Double.isFinite(center)) {
      throw new IllegalArgumentException("mask line center must be positive (was " + center + ")");
    }
    if (!(weight > 0) || !Double.isFinite(weight)) {
      throw new IllegalArgumentException("mask line weight must be positive (was " + weight + ")");
    }
  }
}
