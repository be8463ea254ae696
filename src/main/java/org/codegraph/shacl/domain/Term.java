package org.codegraph.shacl.domain;

/**
 * An RDF term: the value in any position of a {@link Triple}.
 * Terms are immutable and compare structurally.
 */
public sealed interface Term permits Iri, BlankNode, Literal {

  /**
   * Renders this term in N-Triples syntax ({@code <iri>}, {@code _:id},
   * {@code "lex"^^<datatype>} or {@code "lex"@lang}).
   *
   * @return the N-Triples form of the term
   */
  String toNTriples();
}
