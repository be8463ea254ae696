package org.codegraph.shacl.util;

/**
 * How the {@code $this} placeholder of a query-based constraint is bound to the
 * focus node.
 */
public enum SubstitutionMode {
  /** Rewrite the query text (compatible with existing constraint queries). */
  TEXT,
  /** Parse the query and pre-bind {@code ?this} on the syntax tree. */
  ALGEBRAIC
}
