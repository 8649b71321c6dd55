/**
 * CLI entry points for compiling, generating, and querying localized diagnostic catalogs.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses {@code key=value} arguments, merges
 * YAML configuration, and maps failures to {@link ca.gc.cra.diagloc.api.ExitCode}.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 * <p><strong>Output:</strong> Results go to stdout through {@link ca.gc.cra.diagloc.api.CliPrinter}; logs go
 * to stderr.</p>
 */
package ca.gc.cra.diagloc.api;
