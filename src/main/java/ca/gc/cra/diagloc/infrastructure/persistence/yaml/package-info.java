/**
 * YAML catalogs: SnakeYAML-based parser tolerant of unknown identifiers, store backend, and the
 * master-catalog-to-template converter.
 */
package ca.gc.cra.diagloc.infrastructure.persistence.yaml;
