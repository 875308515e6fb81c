package com.pausaler.licensor.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way hashing of customer identifiers.
 */
public class Digests {

  /**
   * Length of an identifier hash in hex characters.
   */
  public static final int IDENTIFIER_HASH_LENGTH = 64;

  private static final HexFormat HEX = HexFormat.of();

  private Digests() {
  }

  /**
   * SHA-256(data).
   *
   * @param data the data
   * @return the 32-byte digest
   */
  public static byte[] sha256(byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Lowercase hex SHA-256 of the trimmed identifier. Unsalted: the result is a correlation key,
   * identical for every issuance to the same identifier.
   *
   * @param identifier the plaintext identifier (PIB)
   * @return 64 lowercase hex characters
   */
  public static String identifierHash(String identifier) {
    return HEX.formatHex(sha256(identifier.trim().getBytes(StandardCharsets.UTF_8)));
  }
}
