/**
 * <strong>Purpose:</strong> Ports between the activity pipeline and its collaborators: spectrum input,
 * result sinks, progress listeners, metrics and clocks.
 * <p><strong>Pipeline role:</strong> Adapters in {@code org.cerespp.infrastructure} implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package org.cerespp.application.port;
