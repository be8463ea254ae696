package org.codegraph.shacl.domain;

import java.util.Arrays;
import java.util.Optional;
import org.codegraph.shacl.vocabulary.Sh;

/**
 * SHACL node kinds ({@code sh:nodeKind} values).
 */
public enum NodeKind {
  IRI(Sh.IRI),
  BLANK_NODE(Sh.BLANK_NODE),
  LITERAL(Sh.LITERAL),
  BLANK_NODE_OR_IRI(Sh.BLANK_NODE_OR_IRI),
  BLANK_NODE_OR_LITERAL(Sh.BLANK_NODE_OR_LITERAL),
  IRI_OR_LITERAL(Sh.IRI_OR_LITERAL);

  private final org.codegraph.shacl.domain.Iri iri;

  NodeKind(org.codegraph.shacl.domain.Iri iri) {
    this.iri = iri;
  }

  public org.codegraph.shacl.domain.Iri iri() {
    return iri;
  }

  /**
   * Checks whether a term's variant matches this node kind.
   *
   * @param term the term to check
   * @return true if the term is of this kind
   */
  public boolean matches(Term term) {
    boolean isIri = term instanceof org.codegraph.shacl.domain.Iri;
    boolean isBlank = term instanceof BlankNode;
    boolean isLiteral = term instanceof Literal;
    return switch (this) {
      case IRI -> isIri;
      case BLANK_NODE -> isBlank;
      case LITERAL -> isLiteral;
      case BLANK_NODE_OR_IRI -> isBlank || isIri;
      case BLANK_NODE_OR_LITERAL -> isBlank || isLiteral;
      case IRI_OR_LITERAL -> isIri || isLiteral;
    };
  }

  /**
   * Resolves a node kind from its SHACL IRI.
   *
   * @param term the {@code sh:nodeKind} value
   * @return the node kind, or empty if the term is not a known node kind IRI
   */
  public static Optional<NodeKind> fromIri(Term term) {
    return Arrays.stream(values())
        .filter(kind -> kind.iri.equals(term))
        .findFirst();
  }
}
