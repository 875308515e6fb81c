package com.pausaler.licensor.verifier;

import com.pausaler.licensor.codec.LicenseJson;
import com.pausaler.licensor.codec.LicenseStringCodec;
import com.pausaler.licensor.codec.LicenseStringCodec.Segments;
import com.pausaler.licensor.common.Digests;
import com.pausaler.licensor.common.Rfc3339;
import com.pausaler.licensor.exceptions.ErrorKind;
import com.pausaler.licensor.exceptions.LicenseException;
import com.pausaler.licensor.key.Ed25519Keys;
import com.pausaler.licensor.model.LicenseType;
import com.pausaler.licensor.model.ReceivedLicensePayload;
import com.pausaler.licensor.model.VerdictReason;
import com.pausaler.licensor.model.VerificationVerdict;
import com.pausaler.licensor.verifier.config.VerifierConfig;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks license strings against the embedded issuer public key.
 * <p>
 * Expected lifecycle states (wrong format, other identifier, not yet valid, expired) come back as a
 * {@link VerificationVerdict}. Input that is not a recognizable, untampered license raises
 * {@link LicenseException}. Holds only the immutable public key, so one instance can serve all threads.
 */
@Singleton
public class LicenseVerifier {

  private static final Logger log = LoggerFactory.getLogger(LicenseVerifier.class);

  private final Ed25519PublicKeyParameters publicKey;

  @Inject
  public LicenseVerifier(final VerifierConfig config) {
    this(config.publicKey());
    log.info("LicenseVerifier({})", config);
  }

  public LicenseVerifier(final Ed25519PublicKeyParameters publicKey) {
    this.publicKey = publicKey;
  }

  /**
   * Verification entry point for callers holding the plaintext identifier and the PEM text.
   *
   * @param license      the license string
   * @param identifier   plaintext identifier currently configured in the application
   * @param publicKeyPem SPKI PEM of the issuer key
   * @param now          the current time
   * @return the verdict
   * @throws LicenseException for malformed or tampered input, or an unusable key
   */
  public static VerificationVerdict verifyLicense(String license, String identifier, String publicKeyPem,
                                                  Instant now) {
    return new LicenseVerifier(Ed25519Keys.verifyingKeyFromPem(publicKeyPem))
        .verify(license, Digests.identifierHash(identifier), now);
  }

  /**
   * Verifies a license string. The steps run in a fixed order and stop at the first failure; the
   * identifier binding is checked before the signature.
   *
   * @param license         the license string
   * @param expectedPibHash identifier hash freshly computed from the configured identifier
   * @param now             the current time
   * @return the verdict
   * @throws LicenseException for malformed or tampered input
   */
  public VerificationVerdict verify(String license, String expectedPibHash, Instant now) {
    final Optional<Segments> segments = LicenseStringCodec.split(license);
    if (segments.isEmpty()) {
      log.debug("verify: license is not two segments");
      return VerificationVerdict.invalidFormat();
    }

    final byte[] payloadBytes = segments.get().payloadBytes();
    final byte[] signatureBytes = segments.get().signatureBytes();
    final ReceivedLicensePayload payload = LicenseJson.readPayload(payloadBytes);

    // Signature not checked yet: type and expiry are hints for display only.
    if (!payload.pibHash().equals(expectedPibHash)) {
      log.debug("verify: identifier hash mismatch");
      return VerificationVerdict.invalid(VerdictReason.PIB_MISMATCH, payload.licenseType(), payload.validUntil());
    }

    if (!Ed25519Keys.verifyStrict(publicKey, payloadBytes, signatureBytes)) {
      throw new LicenseException(ErrorKind.SIGNATURE_INVALID, "signature verification failed");
    }

    final Instant validFrom = Rfc3339.parse(payload.validFrom());
    if (now.isBefore(validFrom)) {
      log.debug("verify: not valid until {}", payload.validFrom());
      return VerificationVerdict.invalid(VerdictReason.NOT_YET_VALID, payload.licenseType(), payload.validUntil());
    }

    return switch (payload.licenseType()) {
      case LIFETIME -> VerificationVerdict.valid(LicenseType.LIFETIME, null);
      case YEARLY -> checkYearly(payload, now);
    };
  }

  private VerificationVerdict checkYearly(ReceivedLicensePayload payload, Instant now) {
    final String until = payload.validUntil();
    if (until == null) {
      throw new LicenseException(ErrorKind.MISSING_VALID_UNTIL, "missing valid_until");
    }
    if (now.isAfter(Rfc3339.parse(until))) {
      log.debug("verify: expired at {}", until);
      return VerificationVerdict.invalid(VerdictReason.EXPIRED, LicenseType.YEARLY, until);
    }
    return VerificationVerdict.valid(LicenseType.YEARLY, until);
  }
}
