package org.cerespp.domain.activity;

/**
 * An index value with its propagated one-sigma uncertainty.
 *
 * @param value index value
 * @param error one-sigma uncertainty
 * @since 0.1.0
 */
public record IndexValue(double value, double error) {}
