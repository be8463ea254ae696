package org.codegraph.shacl.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A query-based constraint: a SELECT template in which {@code $this} stands for
 * the focus node. Every row the query returns is one violation.
 *
 * @param sourceShape the shape that owns this constraint
 * @param message the message attached to violations, or null
 * @param selectQuery the SELECT query template
 * @param prefixes namespace declarations (prefix to namespace IRI) prepended to the query
 */
public record SparqlConstraint(
    Term sourceShape,
    String message,
    String selectQuery,
    Map<String, String> prefixes) {

  /**
   * Creates a new SparqlConstraint with validation.
   *
   * @throws IllegalArgumentException if the query is blank
   */
  public SparqlConstraint {
    Objects.requireNonNull(sourceShape, "SparqlConstraint sourceShape cannot be null");
    Objects.requireNonNull(selectQuery, "SparqlConstraint selectQuery cannot be null");
    if (selectQuery.isBlank()) {
      throw new IllegalArgumentException("SparqlConstraint selectQuery cannot be blank");
    }
    prefixes = prefixes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
  }

  /**
   * Creates a constraint without prefix declarations.
   *
   * @param sourceShape the owning shape
   * @param message the violation message
   * @param selectQuery the query template
   * @return a new SparqlConstraint
   */
  public static SparqlConstraint of(Term sourceShape, String message, String selectQuery) {
    return new SparqlConstraint(sourceShape, message, selectQuery, Map.of());
  }
}
