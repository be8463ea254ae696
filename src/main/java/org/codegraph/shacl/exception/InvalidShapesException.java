package org.codegraph.shacl.exception;

/**
 * Exception thrown when a shapes graph cannot be turned into shapes
 * (missing sh:path or sh:select, bad regex, malformed RDF list).
 */
public class InvalidShapesException extends ShaclException {

  private static final long serialVersionUID = 1L;

  /**
   * Construct exception with message.
   *
   * @param message error message
   */
  public InvalidShapesException(String message) {
    super(message, "invalid_shapes");
  }

  /**
   * Construct exception with message and cause.
   *
   * @param message error message
   * @param cause underlying exception
   */
  public InvalidShapesException(String message, Throwable cause) {
    super(message, "invalid_shapes", cause);
  }
}
