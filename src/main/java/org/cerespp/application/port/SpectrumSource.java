package org.cerespp.application.port;

import java.io.IOException;
import java.nio.file.Path;
import org.cerespp.domain.spectrum.Observation;

/**
 * <strong>What:</strong> Input port loading a reduced echelle observation.
 * <p><strong>Role:</strong> Implemented by {@code FitsSpectrumSource}; tests supply in-memory sources.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent loads of different files.</p>
 *
 * @since 0.1.0
 */
public interface SpectrumSource {
  /**
   * Reads one observation.
   *
   * @param file reduced spectrum file
   * @return orders and metadata
   * @throws IOException if the file cannot be read or does not have the expected layout
   */
  Observation load(Path file) throws IOException;
}
