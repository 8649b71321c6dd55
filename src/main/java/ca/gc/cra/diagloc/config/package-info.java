/**
 * <strong>Purpose:</strong> Configuration loading and composition for DIAGLOC tools: YAML config
 * flattening, CLI/YAML/default merging, master catalog loading, and message store resolution.
 * <p><strong>Observability:</strong> Resolution decisions are logged at DEBUG.
 *
 * @since 0.1.0
 */
package ca.gc.cra.diagloc.config;
