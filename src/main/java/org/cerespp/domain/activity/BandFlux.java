package org.cerespp.domain.activity;

/**
 * Weighted mean flux in one passband.
 *
 * @param flux {@code sum(w f) / sum(w)}
 * @param error {@code sqrt(sum((w e)^2)) / sum(w)}
 * @param pixels number of pixels with positive weight
 * @since 0.1.0
 */
public record BandFlux(double flux, double error, int pixels) {}
