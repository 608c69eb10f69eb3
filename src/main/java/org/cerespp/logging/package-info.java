/**
 * Logging helpers layered over SLF4J and Logback.
 * <p>The MDC key {@code spectrum} carries the input being processed; see {@code logback.xml}.</p>
 */
package org.cerespp.logging;
