package com.pausaler.licensor.verifier.config;

import com.pausaler.licensor.common.Product;
import com.pausaler.licensor.key.Ed25519Keys;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable verifier settings: the embedded issuer public key and the product identifier.
 * <p>
 * Build one at application startup with {@link #load()} and hand it to the components that need it.
 * Nothing is cached globally.
 *
 * @param publicKey issuer public key
 * @param appId     product identifier written into activation codes
 */
public record VerifierConfig(Ed25519PublicKeyParameters publicKey, String appId) {

  private static final Logger log = LoggerFactory.getLogger(VerifierConfig.class);

  /**
   * Classpath location of the embedded issuer public key.
   */
  public static final String PUBLIC_KEY_RESOURCE = "/license/public_key.pem";

  /**
   * Loads the public key shipped with the application.
   *
   * @return the config
   * @throws IllegalStateException if the resource is missing or unreadable
   * @throws com.pausaler.licensor.exceptions.LicenseException if the resource is not an Ed25519 SPKI PEM
   */
  public static VerifierConfig load() {
    return fromPem(readResource(PUBLIC_KEY_RESOURCE), Product.APP_ID);
  }

  /**
   * Builds a config from PEM text.
   *
   * @param publicKeyPem SPKI PEM of the issuer key
   * @param appId        product identifier
   * @return the config
   */
  public static VerifierConfig fromPem(String publicKeyPem, String appId) {
    return new VerifierConfig(Ed25519Keys.verifyingKeyFromPem(publicKeyPem), appId);
  }

  static String readResource(String resource) {
    try (InputStream in = VerifierConfig.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing embedded public key resource: " + resource);
      }
      log.debug("Loading embedded public key from {}", resource);
      return new String(in.readAllBytes(), StandardCharsets.US_ASCII);
    } catch (IOException e) {
      throw new IllegalStateException("Unable to read embedded public key resource: " + resource, e);
    }
  }

  @Override
  public String toString() {
    return "VerifierConfig[appId=" + appId + "]";
  }
}
