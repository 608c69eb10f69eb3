package org.cerespp.infrastructure.fits;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.ArrayFuncs;
import org.cerespp.application.port.SpectrumSource;
import org.cerespp.domain.spectrum.Observation;
import org.cerespp.domain.spectrum.Order;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads a CERES reduced echelle cube from a FITS primary HDU.
 * <p><strong>Layout:</strong> {@code data[layer][order][pixel]}; layer 0 holds wavelengths, the flux and error
 * layers are configurable (continuum-normalized flux 5 and its error 6 by default).</p>
 * <p><strong>Header:</strong> {@code BJD_OUT} (BJD), {@code INST} (instrument) and the target from
 * {@code HIERARCH TARGET NAME}, falling back to {@code OBJECT}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent loads of different files are safe.</p>
 *
 * @since 0.1.0
 */
public final class FitsSpectrumSource implements SpectrumSource {
  private static final Logger log = LoggerFactory.getLogger(FitsSpectrumSource.class);

  static final String KEY_BJD = "BJD_OUT";
  static final String KEY_INSTRUMENT = "INST";
  static final String KEY_TARGET = "HIERARCH.TARGET.NAME";
  static final String KEY_OBJECT = "OBJECT";

  private static final int WAVELENGTH_LAYER = 0;

  private final int fluxLayer;
  private final int errorLayer;

  /**
   * Creates a source.
   *
   * @param fluxLayer cube layer with the flux to analyse
   * @param errorLayer cube layer with the matching one-sigma errors
   */
  public FitsSpectrumSource(int fluxLayer, int errorLayer) {
    if (fluxLayer <= WAVELENGTH_LAYER || errorLayer <= WAVELENGTH_LAYER) {
      throw new IllegalArgumentException("flux and error layers must be positive");
    }
    this.fluxLayer = fluxLayer;
    this.errorLayer = errorLayer;
  }

  @Override
  public Observation load(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (Fits fits = new Fits(file.toFile())) {
      BasicHDU<?> hdu = fits.getHDU(0);
      if (hdu == null) {
        throw new IOException("FITS file " + file + " has no primary HDU");
      }
      Header header = hdu.getHeader();
      double[][][] cube = toCube(file, hdu.getKernel());
      List<Order> orders = readOrders(file, cube);
      if (orders.isEmpty()) {
        throw new IOException("FITS file " + file + " contains no usable orders");
      }
      String target = header.containsKey(KEY_TARGET)
          ? header.getStringValue(KEY_TARGET)
          : header.getStringValue(KEY_OBJECT);
      double bjd = header.getDoubleValue(KEY_BJD, Double.NaN);
      if (Double.isNaN(bjd)) {
        log.warn("{} has no {} keyword; BJD will be reported as missing", file.getFileName(), KEY_BJD);
      }
      return new Observation(file, target, header.getStringValue(KEY_INSTRUMENT), bjd, orders);
    } catch (FitsException ex) {
      throw new IOException("Failed to read FITS file " + file + ": " + ex.getMessage(), ex);
    }
  }

  private double[][][] toCube(Path file, Object kernel) throws IOException {
    if (kernel == null || !kernel.getClass().isArray()) {
      throw new IOException("FITS file " + file + " has no image data in its primary HDU");
    }
    Object converted = ArrayFuncs.convertArray(kernel, double.class);
    if (!(converted instanceof double[][][] cube)) {
      throw new IOException("FITS file " + file + " is not a [layer][order][pixel] cube");
    }
    int needed = Math.max(fluxLayer, errorLayer) + 1;
    if (cube.length < needed) {
      throw new IOException(
          "FITS file " + file + " has " + cube.length + " layers; flux/error layers need " + needed);
    }
    return cube;
  }

  private List<Order> readOrders(Path file, double[][][] cube) {
    double[][] wavelength = cube[WAVELENGTH_LAYER];
    double[][] flux = cube[fluxLayer];
    double[][] error = cube[errorLayer];
    List<Order> orders = new ArrayList<>(wavelength.length);
    for (int o = 0; o < wavelength.length; o++) {
      try {
        orders.add(new Order(o, wavelength[o], flux[o], error[o]));
      } catch (IllegalArgumentException ex) {
        log.warn("Dropping order {} of {}: {}", o, file.getFileName(), ex.getMessage());
      }
    }
    return orders;
  }
}
