package org.cerespp.domain.ccf;

/**
 * Bisector span of a CCF absorption profile, measured on the raw samples.
 *
 * <p>The profile continuum and minimum define a depth scale. At each depth fraction the level is crossed
 * on both sides of the minimum and the midpoint velocity recorded. The span is the mean midpoint of the
 * top band minus the mean midpoint of the bottom band.</p>
 *
 * @since 0.1.0
 */
final class BisectorSpan {
  static final double TOP_FROM = 0.10;
  static final double TOP_TO = 0.40;
  static final double BOTTOM_FROM = 0.60;
  static final double BOTTOM_TO = 0.90;
  static final double DEPTH_STEP = 0.05;

  private BisectorSpan() {}

  /**
   * Measures the span.
   *
   * @param velocities profile velocities, increasing
   * @param values profile values, NaN where invalid
   * @param minIndex index of the profile minimum
   * @param continuum continuum level of the profile
   * @return bisector span in km/s, or NaN when either band has no measurable level
   */
  static double measure(double[] velocities, double[] values, int minIndex, double continuum) {
    double depth = continuum - values[minIndex];
    if (!(depth > 0)) {
      return Double.NaN;
    }
    double top = bandMean(velocities, values, minIndex, continuum, depth, TOP_FROM, TOP_TO);
    double bottom = bandMean(velocities, values, minIndex, continuum, depth, BOTTOM_FROM, BOTTOM_TO);
    return top - bottom;
  }

  private static double bandMean(
      double[] velocities,
      double[] values,
      int minIndex,
      double continuum,
      double depth,
      double from,
      double to) {
    double sum = 0.0;
    int count = 0;
    int steps = (int) Math.round((to - from) / DEPTH_STEP);
    for (int s = 0; s <= steps; s++) {
      double level = continuum - (from + s * DEPTH_STEP) * depth;
      double left = crossing(velocities, values, minIndex, level, -1);
      double right = crossing(velocities, values, minIndex, level, 1);
      if (Double.isFinite(left) && Double.isFinite(right)) {
        sum += 0.5 * (left + right);
        count++;
      }
    }
    return count > 0 ? sum / count : Double.NaN;
  }

  private static double crossing(
      double[] velocities, double[] values, int minIndex, double level, int direction) {
    int inner = minIndex;
    for (int i = minIndex + direction; i >= 0 && i < values.length; i += direction) {
      double value = values[i];
      if (!Double.isFinite(value)) {
        return Double.NaN;
      }
      if (value >= level) {
        double innerValue = values[inner];
        if (value == innerValue) {
          return velocities[i];
        }
        double t = (level - innerValue) / (value - innerValue);
        return velocities[inner] + t * (velocities[i] - velocities[inner]);
      }
      inner = i;
    }
    return Double.NaN;
  }
}
