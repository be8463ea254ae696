package org.codegraph.shacl.domain;

import java.util.Objects;

/**
 * Value object representing an absolute IRI.
 */
public record Iri(String value) implements Term {

  /**
   * Creates a new Iri.
   *
   * @param value the IRI string (must be non-null and non-blank)
   * @throws IllegalArgumentException if value is blank or contains whitespace or angle brackets
   */
  public Iri {
    Objects.requireNonNull(value, "Iri value cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("Iri value cannot be blank");
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isWhitespace(c) || c == '<' || c == '>') {
        throw new IllegalArgumentException("Iri contains illegal character: " + value);
      }
    }
  }

  /**
   * Creates an Iri from a string.
   *
   * @param value the IRI string
   * @return a new Iri
   */
  public static Iri of(String value) {
    return new Iri(value);
  }

  @Override
  public String toNTriples() {
    return "<" + value + ">";
  }

  @Override
  public String toString() {
    return toNTriples();
  }
}
