package com.pausaler.licensor.exceptions;

/**
 * Raised when a license artifact cannot be processed at all. Distinct from an invalid verdict.
 */
public class LicenseException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Instantiates a new License exception.
   *
   * @param kind    the error kind
   * @param message the message
   */
  public LicenseException(final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new License exception.
   *
   * @param kind    the error kind
   * @param message the message
   * @param cause   the cause
   */
  public LicenseException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * The category of failure.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }
}
