package org.cerespp.domain.ccf;

/**
 * Evenly spaced trial velocities for the cross-correlation.
 *
 * @param min first velocity in km/s
 * @param max last velocity in km/s (included when it falls on the grid)
 * @param step spacing in km/s; positive
 * @since 0.1.0
 */
public record VelocityGrid(double min, double max, double step) {
  private static final double EPSILON = 1e-9;

  /** Largest grid that can be materialized as one array. */
  public static final int MAX_POINTS = Integer.MAX_VALUE - 8;

  /**
   * Validates the grid bounds.
   *
   * @throws IllegalArgumentException if the bounds are not finite, {@code max <= min}, {@code step <= 0} or
   *     the grid would hold more than {@link #MAX_POINTS} points
   */
  public VelocityGrid {
    if (!Double.isFinite(min) || !Double.isFinite(max) || !Double.isFinite(step)) {
      throw new IllegalArgumentException("velocity grid bounds must be finite");
    }
    if (!(max > min)) {
      throw new IllegalArgumentException("velocity grid max must exceed min (" + min + " .. " + max + ")");
    }
    if (!(step > 0)) {
      throw new IllegalArgumentException("velocity grid step must be positive (was " + step + ")");
    }
    double intervals = Math.floor((max - min) / step + EPSILON);
    if (intervals >= MAX_POINTS) {
      throw new IllegalArgumentException(
          "velocity grid " + min + " .. " + max + " at " + step + " km/s exceeds " + MAX_POINTS + " points");
    }
  }

  /**
   * Number of grid points.
   *
   * @return point count, at least two
   */
  public int size() {
    return Math.toIntExact((long) Math.floor((max - min) / step + EPSILON) + 1L);
  }

  /**
   * Velocity of grid point {@code i}.
   *
   * @param i point index
   * @return velocity in km/s
   */
  public double velocityAt(int i) {
    return min + i * step;
  }

  /**
   * Materializes the grid.
   *
   * @return velocities in km/s
   */
  public double[] velocities() {
    double[] velocities = new double[size()];
    for (int i = 0; i < velocities.length; i++) {
      velocities[i] = velocityAt(i);
    }
    return velocities;
  }
}
