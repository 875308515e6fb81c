package com.pausaler.licensor.verifier.manager;

import com.pausaler.licensor.codec.ActivationCodeCodec;
import com.pausaler.licensor.common.Digests;
import com.pausaler.licensor.exceptions.LicenseException;
import com.pausaler.licensor.model.VerificationVerdict;
import com.pausaler.licensor.verifier.LicenseVerifier;
import com.pausaler.licensor.verifier.config.VerifierConfig;
import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Licensing operations as the host application uses them: it only ever holds the plaintext identifier,
 * and the hash is recomputed on every call rather than trusted from storage.
 */
@Singleton
public class LicenseManager {
  private static final Logger log = LoggerFactory.getLogger(LicenseManager.class);

  private final String appId;
  private final LicenseVerifier licenseVerifier;
  private final ActivationCodeCodec activationCodeCodec;
  private final Clock clock;

  @Inject
  public LicenseManager(final VerifierConfig config,
                        final LicenseVerifier licenseVerifier,
                        final ActivationCodeCodec activationCodeCodec,
                        final Clock clock) {
    log.info("LicenseManager({})", config);
    this.appId = config.appId();
    this.licenseVerifier = licenseVerifier;
    this.activationCodeCodec = activationCodeCodec;
    this.clock = clock;
  }

  /**
   * Hashes a plaintext identifier.
   *
   * @param identifier the identifier
   * @return lowercase hex SHA-256 of the trimmed identifier
   */
  public String hashIdentifier(String identifier) {
    return Digests.identifierHash(identifier);
  }

  /**
   * Produces an activation code for the user to send to the issuer.
   *
   * @param identifier the plaintext identifier
   * @return the activation code
   * @throws IllegalArgumentException if the identifier is blank
   */
  public String generateActivationCode(String identifier) {
    final String trimmed = requireIdentifier(identifier);
    final long issuedAt = clock.instant().getEpochSecond();
    log.trace("generateActivationCode(issuedAt={})", issuedAt);
    return activationCodeCodec.generate(Digests.identifierHash(trimmed), appId, issuedAt);
  }

  /**
   * Verifies a license for the identifier at the current time.
   *
   * @param license    the license string, surrounding whitespace ignored
   * @param identifier the plaintext identifier
   * @return the verdict
   * @throws LicenseException for malformed or tampered input
   * @throws IllegalArgumentException if the identifier is blank
   */
  public VerificationVerdict verify(String license, String identifier) {
    final String trimmed = requireIdentifier(identifier);
    return licenseVerifier.verify(license == null ? "" : license.trim(), Digests.identifierHash(trimmed),
        clock.instant());
  }

  /**
   * Whether the license currently grants access. Blank input and fatal verification errors count as
   * unlicensed; the latter are logged.
   *
   * @param license    the license string
   * @param identifier the plaintext identifier
   * @return true only for a valid verdict
   */
  public boolean isLicensed(String license, String identifier) {
    if (license == null || license.isBlank() || identifier == null || identifier.isBlank()) {
      return false;
    }
    try {
      final VerificationVerdict verdict = verify(license, identifier);
      if (!verdict.valid()) {
        log.debug("License rejected: {}", verdict.reason());
      }
      return verdict.valid();
    } catch (LicenseException e) {
      log.warn("License is not a valid artifact ({}): {}", e.kind(), e.getMessage());
      return false;
    }
  }

  private static String requireIdentifier(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("identifier is missing");
    }
    return identifier.trim();
  }
}
