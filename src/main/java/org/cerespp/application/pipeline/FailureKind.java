package org.cerespp.application.pipeline;

import java.util.Locale;

/**
 * Reason an observation produced no (or only a partial) result.
 *
 * @since 0.1.0
 */
public enum FailureKind {
  /** The input file could not be read or had an unexpected layout. */
  LOAD,
  /** The CCF peak fit did not converge. */
  CONVERGENCE,
  /** The fitted velocity could not be applied to the wavelength axis. */
  INVALID_RV,
  /** No wavelength sample survived the order merge. */
  MERGE,
  /** A requested artifact could not be written. */
  OUTPUT,
  /** Any other unexpected runtime failure. */
  INTERNAL;

  /**
   * Suffix used in {@code pipeline.failed.<kind>} metrics.
   *
   * @return lower-case name with dashes
   */
  public String metricSuffix() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
