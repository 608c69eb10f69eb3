/**
 * Observed echelle data and the rest-frame transformation.
 * <p><strong>Role:</strong> Domain inputs produced by spectrum sources and consumed by the correlation
 * and merge stages.</p>
 * <p><strong>Concurrency:</strong> Immutable values and stateless transforms.</p>
 *
 * @since 0.1.0
 */
package org.cerespp.domain.spectrum;
