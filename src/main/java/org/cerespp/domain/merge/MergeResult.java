package org.cerespp.domain.merge;

import java.util.List;
import java.util.Objects;
import org.cerespp.domain.error.MergeDataException;

/**
 * Outcome of an order merge: the merged spectrum and the grid points that had to be excluded.
 *
 * @param spectrum merged spectrum
 * @param rejected one entry per excluded wavelength, in wavelength order
 * @since 0.1.0
 */
public record MergeResult(MergedSpectrum spectrum, List<MergeDataException> rejected) {

  public MergeResult {
    Objects.requireNonNull(spectrum, "spectrum");
    rejected = rejected == null ? List.of() : List.copyOf(rejected);
  }
}
