package com.pausaler.licensor.codec;

import com.pausaler.licensor.common.NonceGenerator;
import com.pausaler.licensor.common.TransportEncoding;
import com.pausaler.licensor.exceptions.ActivationCodeException;
import com.pausaler.licensor.exceptions.ActivationCodeException.Reason;
import com.pausaler.licensor.exceptions.LicenseException;
import com.pausaler.licensor.model.ActivationCodePayload;
import java.io.IOException;

/**
 * Builds and reads activation codes, {@code B64URL(json(ActivationCodePayload))}.
 * Activation codes are not signed; only the license issued in response is.
 */
public class ActivationCodeCodec {

  private final NonceGenerator nonceGenerator;

  public ActivationCodeCodec() {
    this(new NonceGenerator());
  }

  public ActivationCodeCodec(NonceGenerator nonceGenerator) {
    this.nonceGenerator = nonceGenerator;
  }

  /**
   * Generates a fresh activation code.
   *
   * @param pibHash  identifier hash
   * @param appId    product identifier
   * @param issuedAt Unix seconds
   * @return the activation code
   */
  public String generate(String pibHash, String appId, long issuedAt) {
    ActivationCodePayload payload = new ActivationCodePayload(pibHash, issuedAt,
        TransportEncoding.encode(nonceGenerator.nonce()), appId);
    return TransportEncoding.encode(LicenseJson.activationCodeBytes(payload));
  }

  /**
   * Decodes an activation code. Surrounding whitespace from copy and paste is ignored.
   * Field values are not validated.
   *
   * @param code the activation code
   * @return the payload
   * @throws ActivationCodeException on malformed base64url or JSON
   */
  public static ActivationCodePayload decode(String code) {
    if (code == null) {
      throw new ActivationCodeException(Reason.MALFORMED_ENCODING, "invalid activation code base64url: missing");
    }
    final byte[] bytes;
    try {
      bytes = TransportEncoding.decode(code.trim());
    } catch (LicenseException e) {
      throw new ActivationCodeException(Reason.MALFORMED_ENCODING,
          "invalid activation code base64url: " + e.getMessage(), e);
    }
    try {
      return LicenseJson.readActivationCode(bytes);
    } catch (IOException e) {
      throw new ActivationCodeException(Reason.MALFORMED_JSON, "invalid activation code json: " + e.getMessage(), e);
    }
  }
}
