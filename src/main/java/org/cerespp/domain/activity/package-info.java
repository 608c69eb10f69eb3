/**
 * Chromospheric activity indices (Ca II S, H-alpha, He I D3, Na I D) measured on merged rest-frame spectra.
 * <p><strong>Role:</strong> Domain numeric core; per-index coverage failures are collected, never propagated.</p>
 * <p><strong>Concurrency:</strong> Immutable values and stateless calculators.</p>
 */
package org.cerespp.domain.activity;
