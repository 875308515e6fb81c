package com.pausaler.licensor.issuer;

import com.pausaler.licensor.codec.ActivationCodeCodec;
import com.pausaler.licensor.exceptions.ActivationCodeException;
import com.pausaler.licensor.exceptions.ActivationCodeException.Reason;
import com.pausaler.licensor.model.ActivationCodePayload;

/**
 * Checks an activation code before a license is issued for it. Each step fails with its own
 * {@link Reason}; the nonce is required but its value is never checked.
 */
public class ActivationCodeValidator {

  private final String expectedAppId;

  public ActivationCodeValidator(final String expectedAppId) {
    this.expectedAppId = expectedAppId;
  }

  /**
   * Decodes and validates an activation code.
   *
   * @param activationCode the code as received from the user
   * @return the validated payload
   * @throws ActivationCodeException at the first failing step
   */
  public ActivationCodePayload validate(String activationCode) {
    final ActivationCodePayload payload = ActivationCodeCodec.decode(activationCode);

    if (payload.pibHash() == null || payload.pibHash().isEmpty()) {
      throw new ActivationCodeException(Reason.MISSING_PIB_HASH, "activation code missing pib_hash");
    }
    if (payload.issuedAt() == null || payload.issuedAt() <= 0) {
      throw new ActivationCodeException(Reason.INVALID_ISSUED_AT, "activation code has invalid issued_at");
    }
    if (payload.nonce() == null || payload.nonce().isEmpty()) {
      throw new ActivationCodeException(Reason.MISSING_NONCE, "activation code missing nonce");
    }
    if (payload.appId() == null) {
      throw new ActivationCodeException(Reason.MISSING_APP_ID, "activation code missing app_id");
    }
    if (!expectedAppId.equals(payload.appId())) {
      throw new ActivationCodeException(Reason.APP_ID_MISMATCH,
          "activation code app_id mismatch: expected " + expectedAppId + ", got " + payload.appId());
    }
    return payload;
  }
}
