package org.codegraph.shacl.domain;

import java.util.Objects;

/**
 * An atomic (subject, predicate, object) fact.
 *
 * @param subject the subject (IRI or blank node)
 * @param predicate the predicate IRI
 * @param object the object term
 */
public record Triple(Term subject, Iri predicate, Term object) {

  /**
   * Creates a new Triple with validation.
   *
   * @throws IllegalArgumentException if the subject is a literal
   */
  public Triple {
    Objects.requireNonNull(subject, "Triple subject cannot be null");
    Objects.requireNonNull(predicate, "Triple predicate cannot be null");
    Objects.requireNonNull(object, "Triple object cannot be null");
    if (subject instanceof Literal) {
      throw new IllegalArgumentException("Triple subject cannot be a literal: " + subject);
    }
  }

  /**
   * Creates a new Triple.
   *
   * @param subject the subject
   * @param predicate the predicate
   * @param object the object
   * @return a new Triple
   */
  public static Triple of(Term subject, Iri predicate, Term object) {
    return new Triple(subject, predicate, object);
  }

  @Override
  public String toString() {
    return subject.toNTriples() + " " + predicate.toNTriples() + " " + object.toNTriples() + " .";
  }
}
