package org.cerespp.domain.ccf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BisectorSpanTest {

  @Test
  void symmetricProfileHasZeroSpan() {
    CcfProfile profile = PeakFitterTest.gaussian(-30.0, 30.0, 0.5, 0.0, 4.0, 0.5, 1.0);

    double bis = BisectorSpan.measure(profile.velocities(), profile.values(), profile.minimumIndex(), 1.0);

    assertEquals(0.0, bis, 1e-9);
  }

  @Test
  void broaderBlueWingGivesNegativeSpan() {
    VelocityGrid grid = new VelocityGrid(-40.0, 40.0, 0.25);
    double[] v = grid.velocities();
    double[] y = new double[v.length];
    for (int i = 0; i < v.length; i++) {
      double sigma = v[i] < 0 ? 6.0 : 3.0;
      double d = v[i] / sigma;
      y[i] = 1.0 - 0.5 * Math.exp(-0.5 * d * d);
    }
    CcfProfile profile = new CcfProfile(v, y);

    double bis = BisectorSpan.measure(v, y, profile.minimumIndex(), 1.0);

    assertTrue(bis < 0, "expected negative span, was " + bis);
  }

  @Test
  void flatProfileHasNoSpan() {
    double[] v = {-1.0, 0.0, 1.0};
    double[] y = {1.0, 1.0, 1.0};

    assertTrue(Double.isNaN(BisectorSpan.measure(v, y, 1, 1.0)));
  }
}
