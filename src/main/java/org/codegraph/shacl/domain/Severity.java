package org.codegraph.shacl.domain;

import org.codegraph.shacl.vocabulary.Sh;

/**
 * Severity of a validation result.
 */
public enum Severity {
  VIOLATION(Sh.VIOLATION),
  WARNING(Sh.WARNING),
  INFO(Sh.INFO);

  private final Iri iri;

  Severity(Iri iri) {
    this.iri = iri;
  }

  public Iri iri() {
    return iri;
  }

  /**
   * Maps a severity IRI to a severity.
   * Anything other than {@code sh:Warning} or {@code sh:Info}, including null,
   * maps to {@link #VIOLATION}.
   *
   * @param term the severity term, may be null
   * @return the severity
   */
  public static Severity fromIri(Term term) {
    if (Sh.WARNING.equals(term)) {
      return WARNING;
    }
    if (Sh.INFO.equals(term)) {
      return INFO;
    }
    return VIOLATION;
  }
}
