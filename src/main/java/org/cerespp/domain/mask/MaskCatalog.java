package org.cerespp.domain.mask;

import org.cerespp.domain.error.UnknownMaskException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable table of the four supported line masks.
 * <p><strong>Why:</strong> Mask tables are process-wide constants; loading them once and passing the
 * catalog explicitly keeps the correlator free of global state.</p>
 * <p><strong>Role:</strong> Configuration object created at start-up and injected into
 * {@code CrossCorrelator} users.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; {@link #builtIn()} is initialized
 * lazily through the holder idiom and shared without locking.</p>
 *
 * <p>Resource format, one line per mask entry, either the CERES three-column layout
 * {@code <line start> <line end> <weight>} (wavelengths in Angstrom, the center is the midpoint) or
 * {@code <center> <weight>}. Blank lines and lines starting with {@code #} are ignored.</p>
 *
 * @since 0.1.0
 */
public final class MaskCatalog {
  private final Map<MaskId, SpectralMask> masks;

  /**
   * Creates a catalog from explicit masks.
   *
   * @param masks masks keyed by id; must contain every {@link MaskId}
   * @throws IllegalArgumentException if a mask id is missing or mapped to a mask of another id
   */
  public MaskCatalog(Map<MaskId, SpectralMask> masks) {
    Objects.requireNonNull(masks, "masks");
    EnumMap<MaskId, SpectralMask> copy = new EnumMap<>(MaskId.class);
    for (MaskId id : MaskId.values()) {
      SpectralMask mask = masks.get(id);
      if (mask == null) {
        throw new IllegalArgumentException("catalog is missing mask " + id);
      }
      if (mask.id() != id) {
        throw new IllegalArgumentException("mask registered as " + id + " reports id " + mask.id());
      }
      copy.put(id, mask);
    }
    this.masks = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the catalog bundled under {@code masks/} on the classpath.
   *
   * @return shared built-in catalog
   * @throws UncheckedIOException if a bundled table is missing or unreadable
   */
  public static MaskCatalog builtIn() {
    return Holder.INSTANCE;
  }

  /**
   * Looks up a mask by id.
   *
   * @param id mask identifier
   * @return mask table
   */
  public SpectralMask get(MaskId id) {
    return masks.get(Objects.requireNonNull(id, "id"));
  }

  /**
   * Looks up a mask by its textual identifier.
   *
   * @param raw identifier such as {@code "K5"}
   * @return mask table
   * @throws UnknownMaskException if the identifier is not supported
   */
  public SpectralMask resolve(String raw) {
    return get(MaskId.parse(raw));
  }

  static MaskCatalog loadBuiltIn() {
    Map<MaskId, SpectralMask> loaded = new EnumMap<>(MaskId.class);
    ClassLoader loader = MaskCatalog.class.getClassLoader();
    for (MaskId id : MaskId.values()) {
      try (InputStream in = loader.getResourceAsStream(id.resourcePath())) {
        if (in == null) {
          throw new UncheckedIOException(new IOException("missing mask resource " + id.resourcePath()));
        }
        loaded.put(id, new SpectralMask(id, parse(id, in)));
      } catch (IOException ex) {
        throw new UncheckedIOException("unable to read mask " + id, ex);
      }
    }
    return new MaskCatalog(loaded);
  }

  static List<MaskLine> parse(MaskId id, InputStream in) throws IOException {
    List<MaskLine> lines = new ArrayList<>();
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    String raw;
    int lineNo = 0;
    while ((raw = reader.readLine()) != null) {
      lineNo++;
      String line = raw.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      String[] tokens = line.split("\\s+");
      if (tokens.length < 2 || tokens.length > 3) {
        throw new IOException(
            "mask " + id + " line " + lineNo + " must contain start, end and weight, or center and weight");
      }
      try {
        lines.add(toLine(tokens));
      } catch (IllegalArgumentException ex) {
        throw new IOException("mask " + id + " line " + lineNo + " is invalid: " + ex.getMessage(), ex);
      }
    }
    return lines;
  }

  private static MaskLine toLine(String[] tokens) {
    if (tokens.length == 2) {
      return new MaskLine(Double.parseDouble(tokens[0]), Double.parseDouble(tokens[1]));
    }
    double start = Double.parseDouble(tokens[0]);
    double end = Double.parseDouble(tokens[1]);
    if (!(end >= start)) {
      throw new IllegalArgumentException("line end " + end + " precedes start " + start);
    }
    return new MaskLine(0.5 * (start + end), Double.parseDouble(tokens[2]));
  }

  private static final class Holder {
    private static final MaskCatalog INSTANCE = loadBuiltIn();
  }
}
