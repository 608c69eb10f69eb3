package org.cerespp.domain.ccf;

import java.util.Arrays;

/**
 * Cross-correlation values sampled on a velocity grid.
 *
 * <p>Samples without any mask-line coverage hold {@link Double#NaN}; they are never replaced by zero.</p>
 *
 * @param velocities trial velocities in km/s, strictly increasing
 * @param values correlation value per velocity, or NaN
 * @since 0.1.0
 */
public record CcfProfile(double[] velocities, double[] values) {

  /**
   * Validates and copies the samples.
   *
   * @throws IllegalArgumentException if the arrays are missing or differ in length
   */
  public CcfProfile {
    if (velocities == null || values == null || velocities.length != values.length) {
      throw new IllegalArgumentException("CCF velocities and values must have equal length");
    }
    velocities = velocities.clone();
    values = values.clone();
  }

  @Override
  public double[] velocities() {
    return velocities.clone();
  }

  @Override
  public double[] values() {
    return values.clone();
  }

  /**
   * Number of samples, valid or not.
   *
   * @return sample count
   */
  public int size() {
    return velocities.length;
  }

  /**
   * Number of samples that carry a finite value.
   *
   * @return valid sample count
   */
  public int validCount() {
    int count = 0;
    for (double value : values) {
      if (Double.isFinite(value)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Index of the smallest finite value.
   *
   * @return index, or {@code -1} when no sample is valid
   */
  public int minimumIndex() {
    int best = -1;
    for (int i = 0; i < values.length; i++) {
      if (Double.isFinite(values[i]) && (best < 0 || values[i] < values[best])) {
        best = i;
      }
    }
    return best;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CcfProfile that)) {
      return false;
    }
    return Arrays.equals(velocities, that.velocities) && Arrays.equals(values, that.values);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(velocities) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "CcfProfile{samples=" + velocities.length + ", valid=" + validCount() + '}';
  }
}
