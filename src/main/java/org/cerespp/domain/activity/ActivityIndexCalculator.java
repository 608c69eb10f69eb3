package org.cerespp.domain.activity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.cerespp.domain.error.CoverageException;
import org.cerespp.domain.merge.MergedSpectrum;

/**
 * <strong>What:</strong> Integrates passbands on a merged rest-frame spectrum and forms the activity indices.
 * <p><strong>Role:</strong> Last numeric stage. Each index is computed independently, so missing coverage for
 * one index never removes another.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ActivityIndexCalculator {
  private final List<IndexDefinition> definitions;
  private final int minBandPixels;

  /**
   * Creates a calculator.
   *
   * @param definitions indices to compute, in reporting order
   * @param minBandPixels minimum pixels with positive weight for a band to count as covered
   */
  public ActivityIndexCalculator(List<IndexDefinition> definitions, int minBandPixels) {
    if (definitions == null || definitions.isEmpty()) {
      throw new IllegalArgumentException("at least one index definition is required");
    }
    if (minBandPixels < 1) {
      throw new IllegalArgumentException("minBandPixels must be at least 1 (was " + minBandPixels + ")");
    }
    this.definitions = List.copyOf(definitions);
    this.minBandPixels = minBandPixels;
  }

  /** @return definitions in reporting order */
  public List<IndexDefinition> definitions() {
    return definitions;
  }

  /**
   * Computes every configured index, collecting coverage failures per index.
   *
   * @param spectrum merged rest-frame spectrum
   * @return computed values and the causes of missing ones
   */
  public ActivityIndices computeAll(MergedSpectrum spectrum) {
    Map<IndexName, IndexValue> values = new EnumMap<>(IndexName.class);
    Map<IndexName, CoverageException> missing = new EnumMap<>(IndexName.class);
    for (IndexDefinition definition : definitions) {
      try {
        values.put(definition.name(), compute(spectrum, definition));
      } catch (CoverageException ex) {
        missing.put(definition.name(), ex);
      }
    }
    return new ActivityIndices(values, missing);
  }

  /**
   * Computes one index with first-order error propagation.
   *
   * @param spectrum merged rest-frame spectrum
   * @param definition index to compute
   * @return value and one-sigma error
   * @throws CoverageException if a band is not covered or the denominator is not usable
   */
  public IndexValue compute(MergedSpectrum spectrum, IndexDefinition definition) {
    String index = definition.name().label();
    double numerator = 0.0;
    double numeratorVariance = 0.0;
    for (Passband band : definition.numerator()) {
      BandFlux flux = integrate(spectrum, band, index);
      numerator += flux.flux();
      numeratorVariance += flux.error() * flux.error();
    }
    double denominator = 0.0;
    double denominatorVariance = 0.0;
    for (Passband band : definition.denominator()) {
      BandFlux flux = integrate(spectrum, band, index);
      denominator += flux.flux();
      denominatorVariance += flux.error() * flux.error();
    }
    if (denominator == 0.0 || !Double.isFinite(denominator)) {
      throw new CoverageException(index, bandNames(definition.denominator()), "sum is zero or not finite");
    }
    double scale = definition.scale();
    double value = scale * numerator / denominator;
    double dN = scale / denominator;
    double dD = scale * numerator / (denominator * denominator);
    double error = Math.sqrt(dN * dN * numeratorVariance + dD * dD * denominatorVariance);
    return new IndexValue(value, error);
  }

  /**
   * Weighted mean flux of one passband.
   *
   * @param spectrum merged spectrum
   * @param band passband
   * @param index index name for diagnostics
   * @return band flux
   * @throws CoverageException if the spectrum does not span the band or too few pixels fall inside it
   */
  BandFlux integrate(MergedSpectrum spectrum, Passband band, String index) {
    if (!spectrum.spans(band.lower(), band.upper())) {
      throw new CoverageException(
          index, band.name(), "[" + band.lower() + ", " + band.upper() + "] lies outside the spectrum");
    }
    double sumW = 0.0;
    double sumWf = 0.0;
    double sumWe2 = 0.0;
    int pixels = 0;
    for (int i = firstAtOrAbove(spectrum, band.lower()); i < spectrum.size(); i++) {
      double lambda = spectrum.wavelengthAt(i);
      if (lambda > band.upper()) {
        break;
      }
      double w = band.weight(lambda);
      double f = spectrum.fluxAt(i);
      if (w <= 0.0 || !Double.isFinite(f)) {
        continue;
      }
      double we = w * spectrum.errorAt(i);
      sumW += w;
      sumWf += w * f;
      sumWe2 += we * we;
      pixels++;
    }
    if (pixels < minBandPixels) {
      throw new CoverageException(
          index, band.name(), "has " + pixels + " usable pixel(s), need " + minBandPixels);
    }
    return new BandFlux(sumWf / sumW, Math.sqrt(sumWe2) / sumW, pixels);
  }

  private static int firstAtOrAbove(MergedSpectrum spectrum, double lambda) {
    int lo = 0;
    int hi = spectrum.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (spectrum.wavelengthAt(mid) < lambda) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  private static String bandNames(List<Passband> bands) {
    StringBuilder sb = new StringBuilder();
    for (Passband band : bands) {
      if (sb.length() > 0) {
        sb.append('+');
      }
      sb.append(band.name());
    }
    return sb.toString();
  }
}
