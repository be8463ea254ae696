package org.codegraph.shacl.exception;

/**
 * Base exception for validator machinery errors.
 * Carries a canonical error code; non-conforming data is never reported this way.
 */
public class ShaclException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;

  /**
   * Constructor with message and code.
   *
   * @param message error message
   * @param code canonical error code
   */
  public ShaclException(String message, String code) {
    super(message);
    this.code = code;
  }

  /**
   * Constructor with message, code, and cause.
   *
   * @param message error message
   * @param code canonical error code
   * @param cause the cause
   */
  public ShaclException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
