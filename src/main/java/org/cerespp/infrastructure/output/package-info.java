/**
 * Result sinks: the fixed-column activity table and the JSON-lines result log.
 */
package org.cerespp.infrastructure.output;
