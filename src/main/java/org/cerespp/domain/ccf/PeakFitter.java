package org.cerespp.domain.ccf;

import java.util.Arrays;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.Pair;
import org.cerespp.domain.error.ConvergenceException;

/**
 * <strong>What:</strong> Fits an inverted Gaussian plus constant to the CCF dip and measures the bisector.
 * <p><strong>Role:</strong> Second numeric stage; its {@link RvFitResult} drives the rest-frame shift.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Performance:</strong> Levenberg-Marquardt on at most a few hundred samples with a fixed
 * iteration budget.</p>
 *
 * @since 0.1.0
 */
public final class PeakFitter {
  /** FWHM of a unit-sigma Gaussian, {@code 2 sqrt(2 ln 2)}. */
  public static final double FWHM_PER_SIGMA = 2.0 * Math.sqrt(2.0 * Math.log(2.0));

  private static final int PARAMETERS = 4;
  private static final int A = 0;
  private static final int MU = 1;
  private static final int SIGMA = 2;
  private static final int B = 3;
  private static final double SINGULARITY_THRESHOLD = 1e-14;

  private final double halfWindowKms;
  private final int minSamples;
  private final int maxIterations;

  /**
   * Creates a fitter.
   *
   * @param halfWindowKms half-width of the fit window around the profile minimum, km/s
   * @param minSamples minimum valid samples inside the window; more than the four model parameters
   * @param maxIterations optimizer iteration budget
   * @throws IllegalArgumentException if a parameter is out of range
   */
  public PeakFitter(double halfWindowKms, int minSamples, int maxIterations) {
    if (!(halfWindowKms > 0) || !Double.isFinite(halfWindowKms)) {
      throw new IllegalArgumentException("fit half-window must be positive (was " + halfWindowKms + ")");
    }
    if (minSamples <= PARAMETERS) {
      throw new IllegalArgumentException(
          "fit needs more than " + PARAMETERS + " samples (minSamples=" + minSamples + ")");
    }
    if (maxIterations < 1) {
      throw new IllegalArgumentException("fit iteration budget must be positive (was " + maxIterations + ")");
    }
    this.halfWindowKms = halfWindowKms;
    this.minSamples = minSamples;
    this.maxIterations = maxIterations;
  }

  /**
   * Fits the profile.
   *
   * @param profile cross-correlation profile
   * @return velocity, width, contrast and bisector span
   * @throws ConvergenceException if too few samples are valid, the optimizer exhausts its budget, the
   *     covariance is singular or the solution is not a finite dip inside the fit window
   */
  public RvFitResult fit(CcfProfile profile) {
    double[] velocities = profile.velocities();
    double[] values = profile.values();
    int minIndex = profile.minimumIndex();
    if (minIndex < 0) {
      throw new ConvergenceException("CCF has no valid samples");
    }
    double continuum = continuum(values);
    double windowLow = velocities[minIndex] - halfWindowKms;
    double windowHigh = velocities[minIndex] + halfWindowKms;

    int n = 0;
    double[] x = new double[values.length];
    double[] y = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      if (Double.isFinite(values[i]) && velocities[i] >= windowLow && velocities[i] <= windowHigh) {
        x[n] = velocities[i];
        y[n] = values[i];
        n++;
      }
    }
    if (n < minSamples) {
      throw new ConvergenceException(
          "only " + n + " valid CCF samples within +-" + halfWindowKms + " km/s of the minimum, need "
              + minSamples);
    }
    x = Arrays.copyOf(x, n);
    y = Arrays.copyOf(y, n);

    double[] start = {
      values[minIndex] - continuum,
      velocities[minIndex],
      initialSigma(velocities, values, minIndex, continuum),
      continuum
    };
    LeastSquaresProblem problem =
        new LeastSquaresBuilder()
            .start(start)
            .model(gaussianModel(x))
            .target(y)
            .lazyEvaluation(false)
            .maxIterations(maxIterations)
            .maxEvaluations(maxIterations * 10)
            .build();

    LeastSquaresOptimizer.Optimum optimum;
    RealMatrix covariance;
    try {
      optimum = new LevenbergMarquardtOptimizer().optimize(problem);
      covariance = optimum.getCovariances(SINGULARITY_THRESHOLD);
    } catch (MathIllegalStateException | MathIllegalArgumentException ex) {
      throw new ConvergenceException("Gaussian fit failed: " + ex.getMessage(), ex);
    }

    double[] p = optimum.getPoint().toArray();
    double sigma = Math.abs(p[SIGMA]);
    if (!allFinite(p) || sigma == 0.0 || p[B] == 0.0) {
      throw new ConvergenceException("Gaussian fit produced a degenerate solution " + Arrays.toString(p));
    }
    if (p[MU] < windowLow || p[MU] > windowHigh) {
      throw new ConvergenceException(
          "fitted center " + p[MU] + " km/s left the fit window [" + windowLow + ", " + windowHigh + "]");
    }

    double chi2 = optimum.getResiduals().dotProduct(optimum.getResiduals());
    double scale = chi2 / (n - PARAMETERS);
    double rvError = Math.sqrt(covariance.getEntry(MU, MU) * scale);
    double fwhmError = FWHM_PER_SIGMA * Math.sqrt(covariance.getEntry(SIGMA, SIGMA) * scale);
    if (!Double.isFinite(rvError)) {
      throw new ConvergenceException("velocity uncertainty is not finite");
    }

    double bis = BisectorSpan.measure(velocities, values, minIndex, continuum);
    return new RvFitResult(
        p[MU],
        rvError,
        bis,
        FWHM_PER_SIGMA * sigma,
        fwhmError,
        -p[A] / p[B],
        p[B],
        optimum.getIterations());
  }

  static double continuum(double[] values) {
    double[] valid = Arrays.stream(values).filter(Double::isFinite).toArray();
    return new Median().evaluate(valid);
  }

  private static double initialSigma(double[] velocities, double[] values, int minIndex, double continuum) {
    double half = values[minIndex] + 0.5 * (continuum - values[minIndex]);
    int left = minIndex;
    while (left > 0 && Double.isFinite(values[left - 1]) && values[left - 1] < half) {
      left--;
    }
    int right = minIndex;
    while (right < values.length - 1 && Double.isFinite(values[right + 1]) && values[right + 1] < half) {
      right++;
    }
    double width = velocities[right] - velocities[left];
    if (width > 0) {
      return width / FWHM_PER_SIGMA;
    }
    double step = velocities.length > 1 ? velocities[1] - velocities[0] : 1.0;
    return 2.0 * step;
  }

  private static MultivariateJacobianFunction gaussianModel(double[] x) {
    return point -> {
      double amplitude = point.getEntry(A);
      double mu = point.getEntry(MU);
      double sigma = point.getEntry(SIGMA);
      double offset = point.getEntry(B);
      RealVector value = new ArrayRealVector(x.length);
      RealMatrix jacobian = new Array2DRowRealMatrix(x.length, PARAMETERS);
      double s2 = sigma * sigma;
      for (int i = 0; i < x.length; i++) {
        double d = x[i] - mu;
        double g = Math.exp(-d * d / (2.0 * s2));
        value.setEntry(i, amplitude * g + offset);
        jacobian.setEntry(i, A, g);
        jacobian.setEntry(i, MU, amplitude * g * d / s2);
        jacobian.setEntry(i, SIGMA, amplitude * g * d * d / (s2 * sigma));
        jacobian.setEntry(i, B, 1.0);
      }
      return new Pair<>(value, jacobian);
    };
  }

  private static boolean allFinite(double[] values) {
    for (double value : values) {
      if (!Double.isFinite(value)) {
        return false;
      }
    }
    return true;
  }
}
