package org.cerespp.infrastructure.fits;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.cerespp.application.port.MergedSpectrumSink;
import org.cerespp.domain.merge.MergedSpectrum;
import org.cerespp.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes the merged rest-frame spectrum as a FITS image {@code [3][n]}: wavelength,
 * flux and error rows.
 * <p><strong>Naming:</strong> {@code <target>_<bjd>_1d_rest_frame.fits} in the output directory; an existing
 * file of the same name is replaced.</p>
 * <p><strong>Thread-safety:</strong> Stateless; distinct observations write distinct files.</p>
 *
 * @since 0.1.0
 */
public final class FitsMergedSpectrumWriter implements MergedSpectrumSink {
  private static final Logger log = LoggerFactory.getLogger(FitsMergedSpectrumWriter.class);

  private final Path outputDirectory;

  public FitsMergedSpectrumWriter(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  /**
   * Builds the artifact file name.
   *
   * @param target target name
   * @param bjd barycentric Julian date
   * @return file name without directory
   */
  public static String fileName(String target, double bjd) {
    String when = Double.isFinite(bjd) ? String.format(Locale.ROOT, "%.6f", bjd) : "nobjd";
    return Strings.toFileToken(target) + "_" + when + "_1d_rest_frame.fits";
  }

  @Override
  public Path write(String target, double bjd, MergedSpectrum spectrum) throws IOException {
    Objects.requireNonNull(spectrum, "spectrum");
    Files.createDirectories(outputDirectory);
    Path file = outputDirectory.resolve(fileName(target, bjd));
    Files.deleteIfExists(file);
    double[][] rows = {spectrum.wavelength(), spectrum.flux(), spectrum.error()};
    try (Fits fits = new Fits()) {
      BasicHDU<?> hdu = Fits.makeHDU(rows);
      Header header = hdu.getHeader();
      header.addValue("OBJECT", target == null ? "unknown" : target, "target name");
      if (Double.isFinite(bjd)) {
        header.addValue("BJD_OUT", bjd, "barycentric Julian date");
      }
      if (Double.isFinite(spectrum.signalToNoise())) {
        header.addValue("SNR", spectrum.signalToNoise(), "median flux / median error");
      }
      header.addValue("ROW1", "wavelength", "Angstrom, stellar rest frame");
      header.addValue("ROW2", "flux", "merged normalized flux");
      header.addValue("ROW3", "error", "one-sigma merged error");
      fits.addHDU(hdu);
      fits.write(file.toFile());
    } catch (FitsException ex) {
      throw new IOException("Failed to write merged spectrum " + file + ": " + ex.getMessage(), ex);
    }
    log.debug("Wrote merged spectrum {} ({} samples)", file, spectrum.size());
    return file;
  }
}
