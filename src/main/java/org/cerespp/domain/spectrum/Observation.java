package org.cerespp.domain.spectrum;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reduced echelle observation handed to the pipeline by an input adapter.
 *
 * <p>{@code bjd} is carried through to the result untouched.</p>
 *
 * @param source file the observation was read from
 * @param target target name from the header, or {@code "unknown"}
 * @param instrument instrument identifier from the header, or {@code "unknown"}
 * @param bjd barycentric Julian date of the exposure
 * @param orders echelle orders; at least one
 * @since 0.1.0
 */
public record Observation(Path source, String target, String instrument, double bjd, List<Order> orders) {

  /**
   * Normalizes names and copies the order list.
   *
   * @throws IllegalArgumentException if no orders are supplied
   */
  public Observation {
    source = Objects.requireNonNull(source, "source");
    target = target == null || target.isBlank() ? "unknown" : target.trim();
    instrument = instrument == null || instrument.isBlank() ? "unknown" : instrument.trim();
    orders = List.copyOf(Objects.requireNonNull(orders, "orders"));
    if (orders.isEmpty()) {
      throw new IllegalArgumentException("observation " + source + " has no orders");
    }
  }
}
