package org.cerespp.domain.activity;

import java.util.List;
import java.util.Objects;

/**
 * Ratio index {@code scale * sum(numerator bands) / sum(denominator bands)}.
 *
 * @param name index identifier
 * @param numerator line-core bands
 * @param denominator reference bands
 * @param scale multiplicative constant
 * @since 0.1.0
 */
public record IndexDefinition(
    IndexName name, List<Passband> numerator, List<Passband> denominator, double scale) {

  public IndexDefinition {
    Objects.requireNonNull(name, "name");
    if (numerator == null || numerator.isEmpty() || denominator == null || denominator.isEmpty()) {
      throw new IllegalArgumentException("index " + name.label() + " needs numerator and denominator bands");
    }
    if (!Double.isFinite(scale) || scale == 0.0) {
      throw new IllegalArgumentException("index " + name.label() + " scale must be finite and non-zero");
    }
    numerator = List.copyOf(numerator);
    denominator = List.copyOf(denominator);
  }
}
