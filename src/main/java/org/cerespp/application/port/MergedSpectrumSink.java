package org.cerespp.application.port;

import java.io.IOException;
import java.nio.file.Path;
import org.cerespp.domain.merge.MergedSpectrum;

/**
 * <strong>What:</strong> Output port persisting the merged rest-frame 1-D spectrum.
 * <p><strong>Role:</strong> Implemented by {@code FitsMergedSpectrumWriter}; only wired when the 1-D artifact
 * is requested.</p>
 *
 * @since 0.1.0
 */
public interface MergedSpectrumSink {
  /**
   * Writes the spectrum.
   *
   * @param target target name
   * @param bjd barycentric Julian date of the observation
   * @param spectrum merged spectrum
   * @return path of the written artifact
   * @throws IOException if writing fails
   */
  Path write(String target, double bjd, MergedSpectrum spectrum) throws IOException;
}
