/**
 * Executor helpers for running batch observations on worker threads.
 */
package org.cerespp.infrastructure.exec;
