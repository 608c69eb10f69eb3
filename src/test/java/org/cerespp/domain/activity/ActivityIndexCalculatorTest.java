package org.cerespp.domain.activity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.cerespp.domain.error.CoverageException;
import org.cerespp.domain.merge.MergedSpectrum;
import org.cerespp.testutil.SyntheticSpectra;
import org.junit.jupiter.api.Test;

class ActivityIndexCalculatorTest {
  private final ActivityIndexCalculator calculator =
      new ActivityIndexCalculator(IndexDefinitions.standard(1.0), 1);

  @Test
  void constantFluxGivesUnitIndices() {
    MergedSpectrum spectrum = constant(3880.0, 6600.0);

    ActivityIndices indices = calculator.computeAll(spectrum);

    assertTrue(indices.missing().isEmpty(), "unexpected gaps: " + indices.missing().keySet());
    for (IndexName name : IndexName.values()) {
      IndexValue value = indices.get(name).orElseThrow();
      assertEquals(1.0, value.value(), 1e-9, name.label());
      assertTrue(value.error() > 0, name.label());
    }
  }

  @Test
  void fluxConfinedToPassbandsGivesTextbookRatios() {
    Map<Passband, Double> levels = new LinkedHashMap<>();
    levels.put(IndexDefinitions.CA_H, 0.4);
    levels.put(IndexDefinitions.CA_K, 0.2);
    levels.put(IndexDefinitions.CA_V, 1.5);
    levels.put(IndexDefinitions.CA_R, 2.5);
    levels.put(IndexDefinitions.H_ALPHA, 0.3);
    levels.put(IndexDefinitions.H_ALPHA_BLUE, 0.9);
    levels.put(IndexDefinitions.H_ALPHA_RED, 1.1);
    levels.put(IndexDefinitions.HE_I, 0.8);
    levels.put(IndexDefinitions.HE_I_BLUE, 1.0);
    levels.put(IndexDefinitions.HE_I_RED, 1.2);
    levels.put(IndexDefinitions.NA_D1, 0.25);
    levels.put(IndexDefinitions.NA_D2, 0.35);
    levels.put(IndexDefinitions.NA_L, 0.9);
    levels.put(IndexDefinitions.NA_R, 1.1);
    double[] wavelength = SyntheticSpectra.grid(3880.0, 6600.0, 0.02);
    double[] flux = new double[wavelength.length];
    double[] error = new double[wavelength.length];
    Arrays.fill(error, SyntheticSpectra.FLUX_ERROR);
    for (int i = 0; i < wavelength.length; i++) {
      for (Map.Entry<Passband, Double> level : levels.entrySet()) {
        Passband band = level.getKey();
        if (wavelength[i] >= band.lower() && wavelength[i] <= band.upper()) {
          flux[i] = level.getValue();
        }
      }
    }
    MergedSpectrum spectrum = new MergedSpectrum(wavelength, flux, error, 100.0);
    ActivityIndexCalculator calibrated = new ActivityIndexCalculator(IndexDefinitions.standard(1.3), 1);

    ActivityIndices indices = calibrated.computeAll(spectrum);

    assertTrue(indices.missing().isEmpty(), "unexpected gaps: " + indices.missing().keySet());
    assertEquals(1.3 * (0.4 + 0.2) / (1.5 + 2.5), indices.get(IndexName.S).orElseThrow().value(), 1e-9);
    assertEquals(2.0 * 0.3 / (0.9 + 1.1), indices.get(IndexName.HALPHA).orElseThrow().value(), 1e-9);
    assertEquals(2.0 * 0.8 / (1.0 + 1.2), indices.get(IndexName.HEI).orElseThrow().value(), 1e-9);
    assertEquals(2.0 * 0.25 / (0.9 + 1.1), indices.get(IndexName.NAID1).orElseThrow().value(), 1e-9);
    assertEquals(2.0 * 0.35 / (0.9 + 1.1), indices.get(IndexName.NAID2).orElseThrow().value(), 1e-9);
    assertEquals((0.25 + 0.35) / (0.9 + 1.1), indices.get(IndexName.NAID1D2).orElseThrow().value(), 1e-9);
  }

  @Test
  void missingHeliumCoverageLeavesOtherIndicesIntact() {
    MergedSpectrum blue = constant(3880.0, 5873.0);
    MergedSpectrum red = constant(5880.0, 6600.0);
    MergedSpectrum gapped = concat(blue, red);

    ActivityIndices indices = calculator.computeAll(gapped);

    assertFalse(indices.get(IndexName.HEI).isPresent());
    CoverageException cause = indices.missingCause(IndexName.HEI).orElseThrow();
    assertEquals("HeI", cause.index());
    assertEquals(1, indices.missing().size());
    assertEquals(1.0, indices.get(IndexName.S).orElseThrow().value(), 1e-9);
    assertEquals(1.0, indices.get(IndexName.HALPHA).orElseThrow().value(), 1e-9);
    assertEquals(1.0, indices.get(IndexName.NAID1).orElseThrow().value(), 1e-9);
    assertEquals(1.0, indices.get(IndexName.NAID2).orElseThrow().value(), 1e-9);
  }

  @Test
  void bandOutsideSpectrumRaisesCoverageException() {
    MergedSpectrum red = constant(5000.0, 6600.0);
    IndexDefinition s = IndexDefinitions.standard(1.0).get(0);

    CoverageException ex = assertThrows(CoverageException.class, () -> calculator.compute(red, s));
    assertEquals("S", ex.index());
  }

  @Test
  void errorFollowsFirstOrderPropagation() {
    MergedSpectrum spectrum = constant(6500.0, 6600.0);
    IndexDefinition halpha = IndexDefinitions.standard(1.0).get(1);

    BandFlux core = calculator.integrate(spectrum, IndexDefinitions.H_ALPHA, "Halpha");
    BandFlux blue = calculator.integrate(spectrum, IndexDefinitions.H_ALPHA_BLUE, "Halpha");
    BandFlux red = calculator.integrate(spectrum, IndexDefinitions.H_ALPHA_RED, "Halpha");
    IndexValue value = calculator.compute(spectrum, halpha);

    double d = blue.flux() + red.flux();
    double dN = 2.0 / d;
    double dD = 2.0 * core.flux() / (d * d);
    double expected = Math.sqrt(
        dN * dN * core.error() * core.error()
            + dD * dD * (blue.error() * blue.error() + red.error() * red.error()));
    assertEquals(expected, value.error(), 1e-15);
    assertEquals(SyntheticSpectra.FLUX_ERROR / Math.sqrt(core.pixels()), core.error(), 1e-12);
  }

  @Test
  void triangularBandWeightsPeakAtCenter() {
    Passband k = IndexDefinitions.CA_K;

    assertEquals(1.0, k.weight(k.center()), 0.0);
    assertEquals(0.5, k.weight(k.center() + k.width() / 2.0), 1e-12);
    assertEquals(0.0, k.weight(k.upper()), 0.0);
  }

  @Test
  void tooFewPixelsInBandIsACoverageGap() {
    ActivityIndexCalculator strict = new ActivityIndexCalculator(IndexDefinitions.standard(1.0), 1_000);
    MergedSpectrum spectrum = constant(5800.0, 6100.0);

    ActivityIndices indices = strict.computeAll(spectrum);

    assertTrue(indices.missingCause(IndexName.NAID1).isPresent());
    assertTrue(indices.missingCause(IndexName.S).isPresent());
  }

  private static MergedSpectrum constant(double from, double to) {
    double[] wavelength = SyntheticSpectra.grid(from, to, 0.02);
    double[] flux = new double[wavelength.length];
    double[] error = new double[wavelength.length];
    Arrays.fill(flux, 1.0);
    Arrays.fill(error, SyntheticSpectra.FLUX_ERROR);
    return new MergedSpectrum(wavelength, flux, error, 100.0);
  }

  private static MergedSpectrum concat(MergedSpectrum a, MergedSpectrum b) {
    return new MergedSpectrum(
        join(a.wavelength(), b.wavelength()), join(a.flux(), b.flux()), join(a.error(), b.error()), 100.0);
  }

  private static double[] join(double[] a, double[] b) {
    double[] out = Arrays.copyOf(a, a.length + b.length);
    System.arraycopy(b, 0, out, a.length, b.length);
    return out;
  }
}
