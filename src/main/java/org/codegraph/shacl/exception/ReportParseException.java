package org.codegraph.shacl.exception;

/**
 * Exception thrown when a serialized validation report is malformed:
 * unparseable text, no report node, or an unreadable conforms flag.
 */
public class ReportParseException extends ShaclException {

  private static final long serialVersionUID = 1L;

  /**
   * Construct exception with message.
   *
   * @param message error message
   */
  public ReportParseException(String message) {
    super(message, "invalid_report");
  }

  /**
   * Construct exception with message and cause.
   *
   * @param message error message
   * @param cause underlying exception
   */
  public ReportParseException(String message, Throwable cause) {
    super(message, "invalid_report", cause);
  }
}
