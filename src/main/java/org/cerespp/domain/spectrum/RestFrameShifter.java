package org.cerespp.domain.spectrum;

import org.cerespp.domain.error.InvalidRvException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Moves orders into the stellar rest frame by removing a radial velocity from their wavelength axes.
 *
 * <p>Each wavelength is multiplied by {@code 1 / (1 + rv / c)}; flux and error samples are left as they are.
 * Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class RestFrameShifter {
  /** Speed of light in km/s. */
  public static final double SPEED_OF_LIGHT_KMS = 299_792.458;

  /**
   * Shifts every order by {@code rv}.
   *
   * @param orders observed-frame orders
   * @param rv radial velocity in km/s (positive means receding)
   * @return new orders in the rest frame, same order as the input
   * @throws InvalidRvException if {@code rv} is not finite or not below the speed of light in magnitude
   */
  public List<Order> toRestFrame(List<Order> orders, double rv) {
    Objects.requireNonNull(orders, "orders");
    double factor = restFactor(rv);
    List<Order> shifted = new ArrayList<>(orders.size());
    for (Order order : orders) {
      double[] wavelength = order.wavelength();
      for (int i = 0; i < wavelength.length; i++) {
        wavelength[i] *= factor;
      }
      shifted.add(order.withWavelength(wavelength));
    }
    return List.copyOf(shifted);
  }

  /**
   * Returns the multiplicative factor applied to observed wavelengths.
   *
   * @param rv radial velocity in km/s
   * @return {@code 1 / (1 + rv / c)}
   * @throws InvalidRvException if {@code rv} is invalid
   */
  public static double restFactor(double rv) {
    if (!Double.isFinite(rv) || Math.abs(rv) >= SPEED_OF_LIGHT_KMS) {
      throw new InvalidRvException(rv);
    }
    return 1.0 / (1.0 + rv / SPEED_OF_LIGHT_KMS);
  }
}
