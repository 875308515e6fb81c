package com.pausaler.licensor.exceptions;

/**
 * Categories of fatal license errors. Each one means the input is not a recognizable,
 * untampered license artifact, as opposed to a {@link com.pausaler.licensor.model.VerdictReason}
 * which describes a normal lifecycle state.
 */
public enum ErrorKind {
  /**
   * A transport-encoded segment is not canonical unpadded base64url.
   */
  MALFORMED_ENCODING,
  /**
   * The payload bytes are not JSON of the license payload shape.
   */
  INVALID_PAYLOAD,
  /**
   * The Ed25519 signature is missing, the wrong length, or does not verify.
   */
  SIGNATURE_INVALID,
  /**
   * The public key is not a PEM-wrapped SPKI Ed25519 key.
   */
  UNSUPPORTED_KEY_FORMAT,
  /**
   * A YEARLY payload has no valid_until.
   */
  MISSING_VALID_UNTIL,
  /**
   * A timestamp is not RFC 3339.
   */
  INVALID_TIMESTAMP
}
