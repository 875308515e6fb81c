package com.pausaler.licensor.issuer.config;

import com.pausaler.licensor.common.Product;
import com.pausaler.licensor.key.Ed25519Keys;
import java.util.HexFormat;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issuer settings: the Ed25519 signing seed and the product identifier activation codes must carry.
 * <p>
 * For production, supply {@code LICENSOR_SIGNING_SEED_HEX} (a hex-encoded 32-byte seed). Omitting it
 * falls back to the built-in development seed, whose public key is the one embedded in development
 * builds of the application.
 * <p>
 * Generate a seed with: {@code openssl rand -hex 32}
 *
 * @param signingSeed   32-byte Ed25519 seed
 * @param expectedAppId product identifier activation codes must match exactly
 */
public record IssuerConfig(byte[] signingSeed, String expectedAppId) {

  private static final Logger log = LoggerFactory.getLogger(IssuerConfig.class);

  /**
   * Environment variable holding the hex-encoded signing seed.
   */
  public static final String SEED_ENV = "LICENSOR_SIGNING_SEED_HEX";
  /**
   * Environment variable overriding the expected product identifier.
   */
  public static final String APP_ID_ENV = "LICENSOR_APP_ID";
  /**
   * Development signing seed. Dev only.
   */
  public static final String DEV_SIGNING_SEED_HEX =
      "c590af4308cc0f6a1a4faccf7c05ff00b3d7d4d38a9ad52b1af10f0c6b3a3f10";

  public IssuerConfig {
    if (signingSeed == null || signingSeed.length != Ed25519Keys.SEED_LENGTH) {
      throw new IllegalArgumentException("signing seed must be " + Ed25519Keys.SEED_LENGTH + " bytes");
    }
    if (expectedAppId == null || expectedAppId.isBlank()) {
      throw new IllegalArgumentException("expected app id is required");
    }
    signingSeed = signingSeed.clone();
  }

  /**
   * Configuration using the development seed and the product identifier.
   *
   * @return the config
   */
  public static IssuerConfig development() {
    return new IssuerConfig(HexFormat.of().parseHex(DEV_SIGNING_SEED_HEX), Product.APP_ID);
  }

  /**
   * Reads the configuration from environment variables.
   *
   * @param env the environment, usually {@link System#getenv()}
   * @return the config
   * @throws IllegalArgumentException if the seed is not 64 hex characters
   */
  public static IssuerConfig fromEnvironment(Map<String, String> env) {
    String seedHex = env.get(SEED_ENV);
    if (seedHex == null || seedHex.isBlank()) {
      log.warn("{} not set, using the development signing seed", SEED_ENV);
      seedHex = DEV_SIGNING_SEED_HEX;
    }
    final byte[] seed;
    try {
      seed = HexFormat.of().parseHex(seedHex.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(SEED_ENV + " must be hex-encoded", e);
    }
    String appId = env.get(APP_ID_ENV);
    if (appId == null || appId.isBlank()) {
      appId = Product.APP_ID;
    }
    return new IssuerConfig(seed, appId);
  }

  @Override
  public byte[] signingSeed() {
    return signingSeed.clone();
  }

  @Override
  public String toString() {
    return "IssuerConfig[expectedAppId=" + expectedAppId + "]";
  }
}
