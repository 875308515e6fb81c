package com.pausaler.licensor.key;

import com.pausaler.licensor.exceptions.ErrorKind;
import com.pausaler.licensor.exceptions.LicenseException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Wraps a raw Ed25519 public key in a SubjectPublicKeyInfo PEM and back.
 * <p>
 * Only one key type and size is understood: the DER is always the fixed 12-byte header
 * {@code SEQUENCE { SEQUENCE { OID 1.3.101.112 } BIT STRING (33) 0x00 }} followed by the 32 key bytes.
 * Anything else is rejected rather than parsed.
 */
public class PublicKeyCodec {

  /**
   * DER header of an Ed25519 SPKI structure, up to and including the unused-bits byte.
   */
  static final byte[] SPKI_PREFIX = {
      0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
  };
  /**
   * Raw Ed25519 public key size.
   */
  public static final int KEY_LENGTH = 32;
  static final int DER_LENGTH = SPKI_PREFIX.length + KEY_LENGTH;

  private static final String BEGIN = "-----BEGIN PUBLIC KEY-----";
  private static final String END = "-----END PUBLIC KEY-----";
  private static final int LINE_WIDTH = 64;

  private PublicKeyCodec() {
  }

  /**
   * Encodes a raw 32-byte public key as SPKI PEM, base64 lines wrapped at 64 columns.
   *
   * @param publicKey the raw public key
   * @return the PEM text, newline terminated
   */
  public static String encode(byte[] publicKey) {
    if (publicKey == null || publicKey.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Ed25519 public key must be " + KEY_LENGTH + " bytes");
    }
    byte[] der = new byte[DER_LENGTH];
    System.arraycopy(SPKI_PREFIX, 0, der, 0, SPKI_PREFIX.length);
    System.arraycopy(publicKey, 0, der, SPKI_PREFIX.length, KEY_LENGTH);

    String b64 = Base64.getEncoder().encodeToString(der);
    StringBuilder out = new StringBuilder();
    out.append(BEGIN).append('\n');
    for (int i = 0; i < b64.length(); i += LINE_WIDTH) {
      out.append(b64, i, Math.min(b64.length(), i + LINE_WIDTH)).append('\n');
    }
    out.append(END).append('\n');
    return out.toString();
  }

  /**
   * Decodes an SPKI PEM into the raw 32-byte Ed25519 public key.
   *
   * @param pem the PEM text
   * @return the raw public key
   * @throws LicenseException with {@link ErrorKind#UNSUPPORTED_KEY_FORMAT} for anything but an Ed25519 SPKI key
   */
  public static byte[] decode(String pem) {
    if (pem == null) {
      throw new LicenseException(ErrorKind.UNSUPPORTED_KEY_FORMAT, "public key pem is missing");
    }
    StringBuilder b64 = new StringBuilder();
    for (String line : pem.split("\\R")) {
      String l = line.trim();
      if (l.isEmpty() || l.startsWith("-----BEGIN") || l.startsWith("-----END")) {
        continue;
      }
      b64.append(l);
    }

    final byte[] der;
    try {
      der = Base64.getDecoder().decode(b64.toString().getBytes(StandardCharsets.US_ASCII));
    } catch (IllegalArgumentException e) {
      throw new LicenseException(ErrorKind.UNSUPPORTED_KEY_FORMAT, "invalid public key pem base64", e);
    }

    if (der.length != DER_LENGTH
        || !Arrays.equals(der, 0, SPKI_PREFIX.length, SPKI_PREFIX, 0, SPKI_PREFIX.length)) {
      throw new LicenseException(ErrorKind.UNSUPPORTED_KEY_FORMAT, "unsupported public key format");
    }
    return Arrays.copyOfRange(der, SPKI_PREFIX.length, DER_LENGTH);
  }
}
