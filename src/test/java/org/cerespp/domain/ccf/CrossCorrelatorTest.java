package org.cerespp.domain.ccf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.cerespp.domain.error.ConvergenceException;
import org.cerespp.domain.mask.MaskCatalog;
import org.cerespp.domain.mask.MaskId;
import org.cerespp.domain.mask.MaskLine;
import org.cerespp.domain.mask.SpectralMask;
import org.cerespp.domain.spectrum.Order;
import org.cerespp.testutil.SyntheticSpectra;
import org.junit.jupiter.api.Test;

class CrossCorrelatorTest {

  @Test
  void recoversInjectedVelocityFromSyntheticG2Spectrum() {
    SpectralMask mask = MaskCatalog.builtIn().get(MaskId.G2);
    List<Order> orders = SyntheticSpectra.absorptionOrders(mask, 15.0, 5000.0, 6000.0, 0.02, 3);
    CrossCorrelator correlator = new CrossCorrelator(new VelocityGrid(-50.0, 50.0, 0.25), 1.5, 5, 20_001);

    CcfProfile profile = correlator.correlate(orders, mask);
    RvFitResult fit = new PeakFitter(20.0, 7, 200).fit(profile);

    assertEquals(401, profile.size());
    assertEquals(15.0, fit.rv(), 0.05);
    assertTrue(fit.contrast() > 0, "contrast should be positive for absorption lines");
    assertTrue(fit.fwhm() > 5.0 && fit.fwhm() < 10.0, "fwhm was " + fit.fwhm());
    assertTrue(Double.isFinite(fit.rvError()) && fit.rvError() >= 0);
    assertEquals(15.0, profile.velocities()[profile.minimumIndex()], 0.5);
  }

  @Test
  void profileWithoutCoverageIsAllNaNAndCannotBeFitted() {
    SpectralMask mask = new SpectralMask(MaskId.G2, List.of(new MaskLine(5000.0, 1.0)));
    Order farAway = SyntheticSpectra.constantOrder(0, 7000.0, 7100.0, 0.05, 1.0, 0.01);
    CrossCorrelator correlator = new CrossCorrelator(new VelocityGrid(-10.0, 10.0, 1.0), 1.5, 5, 100);

    CcfProfile profile = correlator.correlate(List.of(farAway), mask);

    assertEquals(21, profile.size());
    assertEquals(0, profile.validCount());
    assertEquals(-1, profile.minimumIndex());
    assertThrows(ConvergenceException.class, () -> new PeakFitter(20.0, 7, 200).fit(profile));
  }

  @Test
  void linesWhoseWindowLeavesTheOrderAreSkipped() {
    // the first line sits 0.005 A inside the order, so its window always crosses the blue edge
    SpectralMask mask = new SpectralMask(MaskId.G2, List.of(new MaskLine(5000.005, 1.0), new MaskLine(5050.0, 2.0)));
    double[] wavelength = SyntheticSpectra.grid(5000.0, 5100.0, 0.01);
    double[] flux = new double[wavelength.length];
    double[] error = new double[wavelength.length];
    for (int i = 0; i < flux.length; i++) {
      flux[i] = i < 10 ? 0.1 : 0.7;
      error[i] = 0.01;
    }
    Order order = new Order(0, wavelength, flux, error);
    CrossCorrelator correlator = new CrossCorrelator(new VelocityGrid(-1.0, 1.0, 1.0), 1.5, 5, 100);

    CcfProfile profile = correlator.correlate(List.of(order), mask);

    for (double value : profile.values()) {
      assertEquals(0.7, value, 1e-12);
    }
  }

  @Test
  void gridLargerThanCapIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new CrossCorrelator(new VelocityGrid(-200.0, 200.0, 0.01), 1.5, 5, 20_001));
  }

  @Test
  void gridSizeIncludesBothEnds() {
    VelocityGrid grid = new VelocityGrid(-200.0, 200.0, 0.25);

    assertEquals(1601, grid.size());
    assertEquals(-200.0, grid.velocityAt(0), 0.0);
    assertEquals(200.0, grid.velocities()[1600], 1e-9);
  }
}
