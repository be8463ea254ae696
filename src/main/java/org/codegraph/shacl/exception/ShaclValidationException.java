package org.codegraph.shacl.exception;

/**
 * Exception thrown when the validation engine itself fails.
 *
 * <p>This indicates a technical failure (e.g., an interrupted run), not
 * non-conforming data, which always yields a normal validation report.</p>
 */
public class ShaclValidationException extends ShaclException {

  private static final long serialVersionUID = 1L;

  /**
   * Construct exception with message.
   *
   * @param message error message
   */
  public ShaclValidationException(String message) {
    super(message, "validation_error");
  }

  /**
   * Construct exception with message and cause.
   *
   * @param message error message
   * @param cause underlying exception
   */
  public ShaclValidationException(String message, Throwable cause) {
    super(message, "validation_error", cause);
  }
}
