package org.cerespp.domain.ccf;

import java.util.ArrayList;
import java.util.List;
import org.cerespp.domain.mask.MaskLine;
import org.cerespp.domain.mask.SpectralMask;
import org.cerespp.domain.spectrum.Order;
import org.cerespp.domain.spectrum.RestFrameShifter;

/**
 * <strong>What:</strong> Weighted binary-mask cross-correlation of an echelle observation.
 * <p><strong>Role:</strong> First numeric stage; its profile feeds {@link PeakFitter}.</p>
 * <p><strong>Thread-safety:</strong> Immutable and stateless; one instance may be shared across workers.</p>
 * <p><strong>Performance:</strong> Work is bounded by grid size x mask lines x window samples. Mask lines
 * that cannot reach an order at any trial velocity are dropped before the velocity loop.</p>
 *
 * @since 0.1.0
 */
public final class CrossCorrelator {
  private static final double C = RestFrameShifter.SPEED_OF_LIGHT_KMS;

  private final VelocityGrid grid;
  private final double windowKms;
  private final int windowSamples;

  /**
   * Creates a correlator.
   *
   * @param grid trial velocities
   * @param windowKms half-width of the flux accumulation window around each shifted line, km/s
   * @param windowSamples interpolation points across the window; at least one
   * @param maxGridPoints upper bound on {@code grid.size()}
   * @throws IllegalArgumentException if a parameter is out of range or the grid exceeds the bound
   */
  public CrossCorrelator(VelocityGrid grid, double windowKms, int windowSamples, int maxGridPoints) {
    if (grid == null) {
      throw new IllegalArgumentException("velocity grid is required");
    }
    if (!(windowKms > 0) || !Double.isFinite(windowKms)) {
      throw new IllegalArgumentException("window half-width must be positive (was " + windowKms + ")");
    }
    if (windowSamples < 1) {
      throw new IllegalArgumentException("window samples must be at least 1 (was " + windowSamples + ")");
    }
    if (grid.size() > maxGridPoints) {
      throw new IllegalArgumentException(
          "velocity grid has " + grid.size() + " points, limit is " + maxGridPoints);
    }
    this.grid = grid;
    this.windowKms = windowKms;
    this.windowSamples = windowSamples;
  }

  /** @return the trial velocity grid */
  public VelocityGrid grid() {
    return grid;
  }

  /**
   * Correlates the orders against the mask.
   *
   * <p>Each grid sample is the weight-normalized mean flux under the shifted mask lines. A line contributes
   * only through orders that contain its whole accumulation window; samples where no line contributes are
   * NaN.</p>
   *
   * @param orders observed orders
   * @param mask binary mask
   * @return correlation profile on {@link #grid()}
   */
  public CcfProfile correlate(List<Order> orders, SpectralMask mask) {
    double[] velocities = grid.velocities();
    double[] values = new double[velocities.length];
    double[] offsets = windowOffsets();
    double stretchLow = 1.0 + grid.min() / C;
    double stretchHigh = 1.0 + grid.max() / C;

    List<OrderLines> usable = new ArrayList<>(orders.size());
    for (Order order : orders) {
      List<MaskLine> lines =
          mask.linesBetween(
              order.minWavelength() / (stretchHigh * (1.0 + windowKms / C)),
              order.maxWavelength() / (stretchLow * (1.0 - windowKms / C)));
      if (!lines.isEmpty()) {
        usable.add(new OrderLines(order, lines));
      }
    }

    for (int k = 0; k < velocities.length; k++) {
      double stretch = 1.0 + velocities[k] / C;
      double sum = 0.0;
      double usedWeight = 0.0;
      for (OrderLines entry : usable) {
        Order order = entry.order();
        for (MaskLine line : entry.lines()) {
          double center = line.center() * stretch;
          double low = center * (1.0 + offsets[0]);
          double high = center * (1.0 + offsets[offsets.length - 1]);
          if (low < order.minWavelength() || high > order.maxWavelength()) {
            continue;
          }
          double mean = windowMean(order, center, offsets);
          if (Double.isFinite(mean)) {
            sum += line.weight() * mean;
            usedWeight += line.weight();
          }
        }
      }
      values[k] = usedWeight > 0 ? sum / usedWeight : Double.NaN;
    }
    return new CcfProfile(velocities, values);
  }

  private double[] windowOffsets() {
    double[] offsets = new double[windowSamples];
    double half = windowKms / C;
    if (windowSamples == 1) {
      offsets[0] = 0.0;
      return offsets;
    }
    for (int i = 0; i < windowSamples; i++) {
      offsets[i] = -half + 2.0 * half * i / (windowSamples - 1);
    }
    return offsets;
  }

  private static double windowMean(Order order, double center, double[] offsets) {
    double total = 0.0;
    for (double offset : offsets) {
      total += order.interpolateFlux(center * (1.0 + offset));
    }
    return total / offsets.length;
  }

  private record OrderLines(Order order, List<MaskLine> lines) {}
}
