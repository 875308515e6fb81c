package com.pausaler.licensor.issuer;

import com.pausaler.licensor.codec.LicenseJson;
import com.pausaler.licensor.codec.LicenseStringCodec;
import com.pausaler.licensor.issuer.config.IssuerConfig;
import com.pausaler.licensor.key.Ed25519Keys;
import com.pausaler.licensor.key.PublicKeyCodec;
import com.pausaler.licensor.model.ActivationCodePayload;
import com.pausaler.licensor.model.LicensePayload;
import com.pausaler.licensor.model.LicenseType;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues signed license strings in response to activation codes.
 * <p>
 * The payload is serialized exactly once and those bytes are both signed and shipped.
 * Re-serializing after signing could change the byte layout and invalidate the signature.
 */
@Singleton
public class LicenseIssuer {

  private static final Logger log = LoggerFactory.getLogger(LicenseIssuer.class);

  private final Ed25519PrivateKeyParameters signingKey;
  private final ActivationCodeValidator activationCodeValidator;
  private final Clock clock;

  @Inject
  public LicenseIssuer(final IssuerConfig config, final Clock clock) {
    log.info("LicenseIssuer({})", config);
    this.signingKey = Ed25519Keys.signingKey(config.signingSeed());
    this.activationCodeValidator = new ActivationCodeValidator(config.expectedAppId());
    this.clock = clock;
  }

  /**
   * Issues a license for a validated activation code. Validity starts now, truncated to the second.
   *
   * @param activationCode the activation code from the user
   * @param licenseType    the license class to grant
   * @return the license string
   * @throws com.pausaler.licensor.exceptions.ActivationCodeException if the activation code is rejected
   */
  public String issue(String activationCode, LicenseType licenseType) {
    final ActivationCodePayload activation = activationCodeValidator.validate(activationCode);
    final Instant validFrom = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    final LicensePayload payload = LicensePayload.of(licenseType, validFrom, activation.pibHash());
    final String license = sign(payload);
    log.info("Issued {} license valid from {} until {}", licenseType, payload.validFrom(),
        payload.validUntil() == null ? "-" : payload.validUntil());
    return license;
  }

  /**
   * Signs a payload and assembles the license string.
   *
   * @param payload the claims
   * @return the license string
   */
  public String sign(LicensePayload payload) {
    final byte[] payloadBytes = LicenseJson.canonicalBytes(payload);
    final byte[] signature = Ed25519Keys.sign(signingKey, payloadBytes);
    return LicenseStringCodec.join(payloadBytes, signature);
  }

  /**
   * The issuer public key as SPKI PEM, for embedding in the application build.
   *
   * @return the PEM text
   */
  public String publicKeyPem() {
    return PublicKeyCodec.encode(Ed25519Keys.publicKey(signingKey));
  }
}
