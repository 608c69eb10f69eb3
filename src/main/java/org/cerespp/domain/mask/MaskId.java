package org.cerespp.domain.mask;

import org.cerespp.domain.error.UnknownMaskException;
import java.util.Locale;

/**
 * Supported binary line masks, named after the spectral type they were built for.
 *
 * @since 0.1.0
 */
public enum MaskId {
  /** Solar-type template. */
  G2,
  /** Early K dwarf template. */
  K0,
  /** Mid K dwarf template. */
  K5,
  /** Early M dwarf template. */
  M2;

  /**
   * Resolves a mask identifier, ignoring case and surrounding whitespace.
   *
   * @param raw identifier such as {@code "g2"}
   * @return matching mask id
   * @throws UnknownMaskException if {@code raw} is {@code null}, blank or not supported
   */
  public static MaskId parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new UnknownMaskException(raw);
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (MaskId id : values()) {
      if (id.name().equals(normalized)) {
        return id;
      }
    }
    throw new UnknownMaskException(raw);
  }

  /**
   * Classpath location of the line table for this mask.
   *
   * @return resource path relative to the classpath root
   */
  public String resourcePath() {
    return "masks/" + name() + ".mas";
  }
}
