package com.pausaler.licensor.exceptions;

/**
 * Raised when an activation code cannot be turned into a license. Always fatal to the issuance attempt.
 */
public class ActivationCodeException extends RuntimeException {

  /**
   * The validation step that rejected the activation code.
   */
  public enum Reason {
    MALFORMED_ENCODING,
    MALFORMED_JSON,
    MISSING_PIB_HASH,
    INVALID_ISSUED_AT,
    MISSING_NONCE,
    MISSING_APP_ID,
    APP_ID_MISMATCH
  }

  private final Reason reason;

  /**
   * Instantiates a new Activation code exception.
   *
   * @param reason  the failed step
   * @param message the message
   */
  public ActivationCodeException(final Reason reason, final String message) {
    super(message);
    this.reason = reason;
  }

  /**
   * Instantiates a new Activation code exception.
   *
   * @param reason  the failed step
   * @param message the message
   * @param cause   the cause
   */
  public ActivationCodeException(final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
