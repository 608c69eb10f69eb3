/**
 * Step listener adapters: SLF4J logging, JSON-lines step files, fan-out and failure isolation.
 * <p><strong>Concurrency:</strong> Listeners may be called from several batch workers at once.</p>
 */
package org.cerespp.infrastructure.events;
