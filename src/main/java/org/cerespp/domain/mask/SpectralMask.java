package org.cerespp.domain.mask;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Named binary line mask used to cross-correlate an observed spectrum.
 * <p><strong>Why:</strong> The CCF against many weighted lines concentrates the radial-velocity signal of
 * a whole spectrum into a single profile.</p>
 * <p><strong>Role:</strong> Immutable leaf data shared by every pipeline run through {@link MaskCatalog}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share without locking.</p>
 *
 * @param id mask identifier
 * @param lines lines sorted by center wavelength
 * @since 0.1.0
 */
public record SpectralMask(MaskId id, List<MaskLine> lines) {

  /**
   * Sorts and copies the lines.
   *
   * @throws IllegalArgumentException if the mask has no lines
   */
  public SpectralMask {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(lines, "lines");
    if (lines.isEmpty()) {
      throw new IllegalArgumentException("mask " + id + " has no lines");
    }
    List<MaskLine> sorted = new ArrayList<>(lines);
    sorted.sort(Comparator.comparingDouble(MaskLine::center));
    lines = List.copyOf(sorted);
  }

  /**
   * Returns the lines whose centers fall within {@code [min, max]}.
   *
   * @param min lower wavelength bound in Angstrom
   * @param max upper wavelength bound in Angstrom
   * @return matching lines, possibly empty
   */
  public List<MaskLine> linesBetween(double min, double max) {
    List<MaskLine> selected = new ArrayList<>();
    for (MaskLine line : lines) {
      if (line.center() >= min && line.center() <= max) {
        selected.add(line);
      }
    }
    return selected;
  }
}
