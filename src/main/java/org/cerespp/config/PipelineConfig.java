package org.cerespp.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.cerespp.domain.ccf.VelocityGrid;
import org.cerespp.domain.mask.MaskId;
import org.cerespp.validation.Numbers;
import org.cerespp.validation.Strings;

/**
 * <strong>What:</strong> Immutable settings of the activity pipeline.
 * <p><strong>Why:</strong> Centralizes grid, fit, index, input and output knobs so CLI, YAML and defaults
 * resolve to one validated record.</p>
 * <p><strong>Role:</strong> Built by the CLI from the merged key/value map; consumed by
 * {@code ActivityPipeline}, {@code BatchActivityRunner} and the I/O adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across batch workers.</p>
 *
 * @param mask cross-correlation mask
 * @param rvMin first trial velocity, km/s
 * @param rvMax last trial velocity, km/s
 * @param rvStep velocity grid spacing, km/s
 * @param windowKms half-width of the flux window around each shifted mask line, km/s
 * @param windowSamples interpolation points across the window
 * @param maxGridPoints upper bound on the number of trial velocities
 * @param fitHalfWindowKms half-width of the Gaussian fit window around the CCF minimum, km/s
 * @param fitMinSamples minimum valid CCF samples inside the fit window
 * @param fitMaxIterations Levenberg-Marquardt iteration budget
 * @param sIndexCalibration multiplicative constant of the S index
 * @param sIndexCalibrationByInstrument S index constants keyed by upper-case instrument name; instruments
 *     not listed use {@code sIndexCalibration}
 * @param minBandPixels minimum pixels for a passband to count as covered
 * @param fluxLayer cube layer holding the normalized flux
 * @param errorLayer cube layer holding the flux error
 * @param save1d write the merged rest-frame spectrum as a FITS artifact
 * @param missingValue placeholder written for absent table values
 * @param json also write every result as a JSON line
 * @param workers batch worker threads
 * @since 0.1.0
 */
public record PipelineConfig(
    MaskId mask,
    double rvMin,
    double rvMax,
    double rvStep,
    double windowKms,
    int windowSamples,
    int maxGridPoints,
    double fitHalfWindowKms,
    int fitMinSamples,
    int fitMaxIterations,
    double sIndexCalibration,
    Map<String, Double> sIndexCalibrationByInstrument,
    int minBandPixels,
    int fluxLayer,
    int errorLayer,
    boolean save1d,
    String missingValue,
    boolean json,
    int workers) {

  /** Key prefix of the per-instrument S index constants, e.g. {@code activity.sIndexCalibration.HARPS}. */
  public static final String S_CALIBRATION_PREFIX = "activity.sIndexCalibration.";

  /** Largest accepted velocity grid size. */
  public static final int GRID_POINTS_CEILING = 200_001;

  /**
   * Validates every setting.
   *
   * @throws IllegalArgumentException naming the offending key when a value is out of range
   */
  public PipelineConfig {
    Objects.requireNonNull(mask, "mask");
    Numbers.requireRange("ccf.rvMin", rvMin, -100_000.0, 100_000.0);
    Numbers.requireRange("ccf.rvMax", rvMax, -100_000.0, 100_000.0);
    if (!(rvMax > rvMin)) {
      throw new IllegalArgumentException("ccf.rvMax must exceed ccf.rvMin (" + rvMin + " .. " + rvMax + ")");
    }
    Numbers.requirePositive("ccf.rvStep", rvStep);
    Numbers.requirePositive("ccf.windowKms", windowKms);
    Numbers.requireRange("ccf.windowSamples", windowSamples, 1, 101);
    Numbers.requireRange("ccf.maxGridPoints", maxGridPoints, 2, GRID_POINTS_CEILING);
    Numbers.requirePositive("fit.halfWindowKms", fitHalfWindowKms);
    Numbers.requireRange("fit.minSamples", fitMinSamples, 5, 100_000);
    Numbers.requireRange("fit.maxIterations", fitMaxIterations, 1, 100_000);
    if (!Double.isFinite(sIndexCalibration) || sIndexCalibration == 0.0) {
      throw new IllegalArgumentException(
          "activity.sIndexCalibration must be finite and non-zero (was " + sIndexCalibration + ")");
    }
    Map<String, Double> byInstrument = new TreeMap<>();
    if (sIndexCalibrationByInstrument != null) {
      for (Map.Entry<String, Double> entry : sIndexCalibrationByInstrument.entrySet()) {
        String instrument = normalizeInstrument(entry.getKey());
        Double constant = entry.getValue();
        if (instrument.isEmpty() || constant == null || !Double.isFinite(constant) || constant == 0.0) {
          throw new IllegalArgumentException(
              S_CALIBRATION_PREFIX + entry.getKey() + " must be finite and non-zero (was " + constant + ")");
        }
        byInstrument.put(instrument, constant);
      }
    }
    sIndexCalibrationByInstrument = Collections.unmodifiableMap(byInstrument);
    Numbers.requireRange("activity.minBandPixels", minBandPixels, 1, 100_000);
    Numbers.requireRange("input.fluxLayer", fluxLayer, 0, 64);
    Numbers.requireRange("input.errorLayer", errorLayer, 0, 64);
    if (fluxLayer == 0 || errorLayer == 0) {
      throw new IllegalArgumentException("input.fluxLayer and input.errorLayer must not point at the wavelength layer 0");
    }
    missingValue = Strings.requireNonBlank("output.missingValue", missingValue);
    Numbers.requireRange("batch.workers", workers, 1, 256);
    VelocityGrid grid;
    try {
      grid = new VelocityGrid(rvMin, rvMax, rvStep);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("ccf.rvStep: " + ex.getMessage(), ex);
    }
    if (grid.size() > maxGridPoints) {
      throw new IllegalArgumentException(
          "velocity grid has " + grid.size() + " points, ccf.maxGridPoints is " + maxGridPoints);
    }
  }

  /**
   * Returns the default configuration.
   *
   * @return G2 mask, -200..200 km/s at 0.25 km/s, 1.5 km/s windows of 5 samples, 20 km/s fit window
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(
        MaskId.G2,
        -200.0,
        200.0,
        0.25,
        1.5,
        5,
        20_001,
        20.0,
        7,
        200,
        1.0,
        Map.of(),
        1,
        5,
        6,
        false,
        "-999",
        false,
        1);
  }

  /**
   * Builds a configuration from flattened key/value options, falling back to {@link #defaults()}.
   *
   * <p>The CLI aliases {@code save1d}, {@code json} and {@code workers} take precedence over their
   * dotted keys.</p>
   *
   * @param options merged options (CLI, YAML, defaults); must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if a value cannot be parsed or is out of range
   * @throws org.cerespp.domain.error.UnknownMaskException if {@code mask} names an unsupported mask
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PipelineConfig d = defaults();
    String maskRaw = trimmed(options.get("mask"));
    MaskId mask = maskRaw.isEmpty() ? d.mask() : MaskId.parse(maskRaw);
    return new PipelineConfig(
        mask,
        parseDouble(options, "ccf.rvMin", d.rvMin()),
        parseDouble(options, "ccf.rvMax", d.rvMax()),
        parseDouble(options, "ccf.rvStep", d.rvStep()),
        parseDouble(options, "ccf.windowKms", d.windowKms()),
        parseInt(options, "ccf.windowSamples", d.windowSamples()),
        parseInt(options, "ccf.maxGridPoints", d.maxGridPoints()),
        parseDouble(options, "fit.halfWindowKms", d.fitHalfWindowKms()),
        parseInt(options, "fit.minSamples", d.fitMinSamples()),
        parseInt(options, "fit.maxIterations", d.fitMaxIterations()),
        parseDouble(options, "activity.sIndexCalibration", d.sIndexCalibration()),
        parseInstrumentCalibrations(options),
        parseInt(options, "activity.minBandPixels", d.minBandPixels()),
        parseInt(options, "input.fluxLayer", d.fluxLayer()),
        parseInt(options, "input.errorLayer", d.errorLayer()),
        parseBoolean(options, d.save1d(), "save1d", "output.save1d"),
        firstNonBlank(options, d.missingValue(), "output.missingValue"),
        parseBoolean(options, d.json(), "json", "output.json"),
        parseInt(options, firstPresentKey(options, "workers", "batch.workers"), d.workers()));
  }

  /**
   * S index constant for an instrument.
   *
   * @param instrument instrument name from the input header; matched case-insensitively
   * @return the instrument's constant, or {@link #sIndexCalibration()} when none is configured
   */
  public double sIndexCalibrationFor(String instrument) {
    Double constant = sIndexCalibrationByInstrument.get(normalizeInstrument(instrument));
    return constant == null ? sIndexCalibration : constant;
  }

  /**
   * Returns the trial velocity grid.
   *
   * @return grid spanning {@code rvMin..rvMax}
   */
  public VelocityGrid velocityGrid() {
    return new VelocityGrid(rvMin, rvMax, rvStep);
  }

  /**
   * Flattens this configuration back into the key space accepted by {@link #fromMap(Map)}.
   *
   * @return ordered key/value view
   */
  public Map<String, String> toFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("mask", mask.name());
    map.put("ccf.rvMin", Double.toString(rvMin));
    map.put("ccf.rvMax", Double.toString(rvMax));
    map.put("ccf.rvStep", Double.toString(rvStep));
    map.put("ccf.windowKms", Double.toString(windowKms));
    map.put("ccf.windowSamples", Integer.toString(windowSamples));
    map.put("ccf.maxGridPoints", Integer.toString(maxGridPoints));
    map.put("fit.halfWindowKms", Double.toString(fitHalfWindowKms));
    map.put("fit.minSamples", Integer.toString(fitMinSamples));
    map.put("fit.maxIterations", Integer.toString(fitMaxIterations));
    map.put("activity.sIndexCalibration", Double.toString(sIndexCalibration));
    for (Map.Entry<String, Double> entry : sIndexCalibrationByInstrument.entrySet()) {
      map.put(S_CALIBRATION_PREFIX + entry.getKey(), Double.toString(entry.getValue()));
    }
    map.put("activity.minBandPixels", Integer.toString(minBandPixels));
    map.put("input.fluxLayer", Integer.toString(fluxLayer));
    map.put("input.errorLayer", Integer.toString(errorLayer));
    map.put("output.save1d", Boolean.toString(save1d));
    map.put("output.missingValue", missingValue);
    map.put("output.json", Boolean.toString(json));
    map.put("batch.workers", Integer.toString(workers));
    return map;
  }

  private static double parseDouble(Map<String, String> options, String key, double defaultValue) {
    String raw = trimmed(options.get(key));
    if (raw.isEmpty()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was '" + raw + "')", ex);
    }
  }

  private static Map<String, Double> parseInstrumentCalibrations(Map<String, String> options) {
    Map<String, Double> byInstrument = new TreeMap<>();
    for (String key : options.keySet()) {
      if (key.startsWith(S_CALIBRATION_PREFIX)) {
        String instrument = key.substring(S_CALIBRATION_PREFIX.length());
        byInstrument.put(instrument, parseDouble(options, key, Double.NaN));
      }
    }
    return byInstrument;
  }

  private static String normalizeInstrument(String instrument) {
    return trimmed(instrument).toUpperCase(Locale.ROOT);
  }

  private static int parseInt(Map<String, String> options, String key, int defaultValue) {
    String raw = key == null ? "" : trimmed(options.get(key));
    if (raw.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static boolean parseBoolean(Map<String, String> options, boolean defaultValue, String... keys) {
    for (String key : keys) {
      String raw = trimmed(options.get(key)).toLowerCase(Locale.ROOT);
      if (raw.isEmpty()) {
        continue;
      }
      if (!raw.equals("true") && !raw.equals("false")) {
        throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
      }
      return Boolean.parseBoolean(raw);
    }
    return defaultValue;
  }

  private static String firstNonBlank(Map<String, String> options, String defaultValue, String... keys) {
    for (String key : keys) {
      String raw = trimmed(options.get(key));
      if (!raw.isEmpty()) {
        return raw;
      }
    }
    return defaultValue;
  }

  private static String firstPresentKey(Map<String, String> options, String... keys) {
    for (String key : keys) {
      if (!trimmed(options.get(key)).isEmpty()) {
        return key;
      }
    }
    return null;
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
