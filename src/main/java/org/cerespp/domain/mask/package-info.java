/**
 * Binary line masks used for radial-velocity cross-correlation.
 * <p>Masks are immutable and loaded once per process; they are safe to share across concurrent runs.</p>
 *
 * @since 0.1.0
 */
package org.cerespp.domain.mask;
