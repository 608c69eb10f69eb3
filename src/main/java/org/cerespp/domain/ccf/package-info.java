/**
 * Cross-correlation against binary masks and Gaussian peak fitting of the resulting profile.
 * <p><strong>Role:</strong> Domain numeric core; produces the radial velocity consumed by the rest-frame shift.</p>
 * <p><strong>Concurrency:</strong> Stateless services and immutable values; safe across worker threads.</p>
 */
package org.cerespp.domain.ccf;
