package org.codegraph.shacl.vocabulary;

import org.codegraph.shacl.domain.Iri;

/**
 * RDF and RDFS vocabulary IRIs used by shapes and reports.
 */
public final class Rdf {

  public static final String NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
  public static final String RDFS_NS = "http://www.w3.org/2000/01/rdf-schema#";

  public static final Iri TYPE = new Iri(NS + "type");
  public static final Iri FIRST = new Iri(NS + "first");
  public static final Iri REST = new Iri(NS + "rest");
  public static final Iri NIL = new Iri(NS + "nil");
  public static final Iri LANG_STRING = new Iri(NS + "langString");

  public static final Iri RDFS_CLASS = new Iri(RDFS_NS + "Class");

  private Rdf() {
    // Vocabulary constants
  }
}
