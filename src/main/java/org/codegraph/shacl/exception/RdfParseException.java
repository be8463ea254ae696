package org.codegraph.shacl.exception;

/**
 * Exception thrown when RDF text cannot be parsed.
 */
public class RdfParseException extends ShaclException {

  private static final long serialVersionUID = 1L;

  public RdfParseException(String message) {
    super(message, "invalid_rdf");
  }

  public RdfParseException(String message, Throwable cause) {
    super(message, "invalid_rdf", cause);
  }
}
