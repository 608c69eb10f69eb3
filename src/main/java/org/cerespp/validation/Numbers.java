package org.cerespp.validation;

/**
 * <strong>What:</strong> Numeric validation helpers for pipeline configuration values.
 * <p><strong>Why:</strong> Ensures grid, fit and worker settings stay within safe bounds.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name configuration key used in the error message; may be {@code null}
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} when valid
   * @throws IllegalArgumentException if {@code value} lies outside the range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is finite and lies within {@code [min, max]}.
   *
   * @param name configuration key used in the error message; may be {@code null}
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} when valid
   * @throws IllegalArgumentException if {@code value} is NaN, infinite or outside the range
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is finite and strictly positive.
   *
   * @param name configuration key used in the error message; may be {@code null}
   * @param value candidate value
   * @return {@code value} when valid
   * @throws IllegalArgumentException if {@code value} is not a positive finite number
   */
  public static double requirePositive(String name, double value) {
    if (!Double.isFinite(value) || value <= 0) {
      throw new IllegalArgumentException(label(name) + " must be a positive number (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
