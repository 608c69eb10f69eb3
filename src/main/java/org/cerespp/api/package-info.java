/**
 * Command-line entry points: the {@code cerespp} dispatcher and the {@code process} and {@code batch}
 * commands.
 * <p><strong>Role:</strong> Adapter layer; parses {@code key=value} arguments, merges YAML and defaults,
 * wires the FITS, table and metrics adapters, and maps failures to {@link org.cerespp.api.ExitCode}.</p>
 * <p><strong>Output:</strong> Help, dry-run plans and per-file summaries go to stdout via
 * {@link org.cerespp.api.CliPrinter}; diagnostics go through SLF4J.</p>
 */
package org.cerespp.api;
