package org.cerespp.domain.merge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.cerespp.domain.error.MergeDataException;
import org.cerespp.domain.spectrum.Order;

/**
 * <strong>What:</strong> Combines overlapping rest-frame orders into one spectrum by inverse-variance weighting.
 * <p><strong>Role:</strong> Fourth numeric stage, between the rest-frame shift and the activity indices.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 * <p><strong>Performance:</strong> Linear in the union grid size times the number of overlapping orders.</p>
 *
 * @since 0.1.0
 */
public final class EchelleMerger {

  /**
   * Merges the orders onto the union of their wavelength samples.
   *
   * <p>Every order whose span contains a grid wavelength contributes its flux and error there, sampled
   * exactly or by linear interpolation. Contributions with non-finite flux or with zero or non-finite
   * error are ignored. A grid point left without contributions is excluded and reported in
   * {@link MergeResult#rejected()}.</p>
   *
   * @param orders rest-frame orders
   * @return merged spectrum and excluded points
   * @throws IllegalArgumentException if {@code orders} is empty
   * @throws MergeDataException if no grid point has a usable contribution
   */
  public MergeResult merge(List<Order> orders) {
    if (orders == null || orders.isEmpty()) {
      throw new IllegalArgumentException("at least one order is required to merge");
    }
    double[] grid = unionGrid(orders);
    double[] wavelength = new double[grid.length];
    double[] flux = new double[grid.length];
    double[] error = new double[grid.length];
    List<MergeDataException> rejected = new ArrayList<>();
    int kept = 0;

    for (double lambda : grid) {
      double weightedFlux = 0.0;
      double inverseVariance = 0.0;
      int covering = 0;
      for (Order order : orders) {
        if (!order.covers(lambda)) {
          continue;
        }
        covering++;
        double f = order.interpolateFlux(lambda);
        double e = order.interpolateError(lambda);
        if (!Double.isFinite(f) || !Double.isFinite(e) || e <= 0.0) {
          continue;
        }
        double w = 1.0 / (e * e);
        weightedFlux += f * w;
        inverseVariance += w;
      }
      if (inverseVariance == 0.0) {
        rejected.add(new MergeDataException(lambda, covering));
        continue;
      }
      wavelength[kept] = lambda;
      flux[kept] = weightedFlux / inverseVariance;
      error[kept] = 1.0 / Math.sqrt(inverseVariance);
      kept++;
    }

    if (kept == 0) {
      throw rejected.get(0);
    }
    wavelength = Arrays.copyOf(wavelength, kept);
    flux = Arrays.copyOf(flux, kept);
    error = Arrays.copyOf(error, kept);
    MergedSpectrum spectrum = new MergedSpectrum(wavelength, flux, error, signalToNoise(flux, error));
    return new MergeResult(spectrum, rejected);
  }

  static double[] unionGrid(List<Order> orders) {
    int total = 0;
    for (Order order : orders) {
      total += order.size();
    }
    double[] all = new double[total];
    int pos = 0;
    for (Order order : orders) {
      double[] w = order.wavelength();
      System.arraycopy(w, 0, all, pos, w.length);
      pos += w.length;
    }
    Arrays.sort(all);
    int unique = 0;
    for (int i = 0; i < all.length; i++) {
      if (unique == 0 || all[i] != all[unique - 1]) {
        all[unique++] = all[i];
      }
    }
    return Arrays.copyOf(all, unique);
  }

  private static double signalToNoise(double[] flux, double[] error) {
    Median median = new Median();
    double medianError = median.evaluate(error);
    return medianError > 0 ? median.evaluate(flux) / medianError : Double.NaN;
  }
}
