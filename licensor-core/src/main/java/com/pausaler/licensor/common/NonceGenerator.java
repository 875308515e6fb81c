package com.pausaler.licensor.common;

import java.security.SecureRandom;

/**
 * Source of activation code nonces. A nonce only separates two requests for the same identifier made
 * within the same second; nothing records or checks it afterwards.
 */
public class NonceGenerator {

  /**
   * Nonce size in bytes before transport encoding.
   */
  public static final int NONCE_LENGTH = 16;

  private final SecureRandom random;

  public NonceGenerator() {
    this(new SecureRandom());
  }

  public NonceGenerator(final SecureRandom random) {
    this.random = random;
  }

  /**
   * Draws a fresh nonce.
   *
   * @return {@value #NONCE_LENGTH} random bytes
   */
  public byte[] nonce() {
    final byte[] nonce = new byte[NONCE_LENGTH];
    random.nextBytes(nonce);
    return nonce;
  }
}
