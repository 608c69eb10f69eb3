/**
 * Adapters implementing the application ports: FITS I/O, result writers, step listeners, metrics, executors
 * and clocks.
 *
 * @since 0.1.0
 */
package org.cerespp.infrastructure;
