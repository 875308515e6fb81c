package com.pausaler.licensor.key;

import com.pausaler.licensor.exceptions.ErrorKind;
import com.pausaler.licensor.exceptions.LicenseException;
import java.util.Arrays;
import java.util.HexFormat;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * Ed25519 key handling and signatures over BouncyCastle's lightweight API.
 */
public class Ed25519Keys {

  /**
   * Signing key seed size in bytes.
   */
  public static final int SEED_LENGTH = 32;
  /**
   * Signature size in bytes.
   */
  public static final int SIGNATURE_LENGTH = 64;

  /**
   * Encodings of the eight points of order dividing 8, plus the sign-bit variants of the
   * two points with x = 0. Strict verification refuses these as either the public key A or the
   * signature's R component.
   */
  private static final byte[][] SMALL_ORDER_ENCODINGS = decodeAll(
      "0100000000000000000000000000000000000000000000000000000000000000",
      "0100000000000000000000000000000000000000000000000000000000000080",
      "ecffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff7f",
      "ecffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
      "0000000000000000000000000000000000000000000000000000000000000000",
      "0000000000000000000000000000000000000000000000000000000000000080",
      "26e8958fc2b227b045c3f489f2ef98f0d5dfac05d3c63339b13802886d53fc05",
      "26e8958fc2b227b045c3f489f2ef98f0d5dfac05d3c63339b13802886d53fc85",
      "c7176a703d4dd84fba3c0b760d10670f2a2053fa2c39ccc64ec7fd7792ac037a",
      "c7176a703d4dd84fba3c0b760d10670f2a2053fa2c39ccc64ec7fd7792ac03fa"
  );

  private Ed25519Keys() {
  }

  /**
   * Builds the signing key from a 32-byte seed.
   *
   * @param seed the seed
   * @return the private key parameters
   */
  public static Ed25519PrivateKeyParameters signingKey(byte[] seed) {
    if (seed == null || seed.length != SEED_LENGTH) {
      throw new IllegalArgumentException("Ed25519 seed must be " + SEED_LENGTH + " bytes");
    }
    return new Ed25519PrivateKeyParameters(seed, 0);
  }

  /**
   * The raw 32-byte public key matching a signing key.
   *
   * @param signingKey the signing key
   * @return the raw public key
   */
  public static byte[] publicKey(Ed25519PrivateKeyParameters signingKey) {
    return signingKey.generatePublicKey().getEncoded();
  }

  /**
   * Parses a raw 32-byte public key.
   *
   * @param raw the raw public key
   * @return the public key parameters
   * @throws LicenseException with {@link ErrorKind#UNSUPPORTED_KEY_FORMAT} if the bytes are not a curve point
   */
  public static Ed25519PublicKeyParameters verifyingKey(byte[] raw) {
    if (raw == null || raw.length != PublicKeyCodec.KEY_LENGTH) {
      throw new LicenseException(ErrorKind.UNSUPPORTED_KEY_FORMAT, "invalid public key length");
    }
    try {
      return new Ed25519PublicKeyParameters(raw, 0);
    } catch (IllegalArgumentException e) {
      throw new LicenseException(ErrorKind.UNSUPPORTED_KEY_FORMAT, "invalid public key bytes", e);
    }
  }

  /**
   * Decodes an SPKI PEM straight into public key parameters.
   *
   * @param pem the PEM text
   * @return the public key parameters
   */
  public static Ed25519PublicKeyParameters verifyingKeyFromPem(String pem) {
    return verifyingKey(PublicKeyCodec.decode(pem));
  }

  /**
   * Signs a message.
   *
   * @param signingKey the signing key
   * @param message    the exact bytes to sign
   * @return the 64-byte signature
   */
  public static byte[] sign(Ed25519PrivateKeyParameters signingKey, byte[] message) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, signingKey);
    signer.update(message, 0, message.length);
    return signer.generateSignature();
  }

  /**
   * Verifies a signature, additionally refusing small-order public keys and R components.
   * BouncyCastle already rejects non-canonical point encodings and S values not below the group order.
   *
   * @param publicKey the public key
   * @param message   the exact bytes that were signed
   * @param signature the signature
   * @return true when the signature is valid
   */
  public static boolean verifyStrict(Ed25519PublicKeyParameters publicKey, byte[] message, byte[] signature) {
    if (signature == null || signature.length != SIGNATURE_LENGTH) {
      return false;
    }
    if (isSmallOrder(publicKey.getEncoded()) || isSmallOrder(Arrays.copyOfRange(signature, 0, 32))) {
      return false;
    }
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, publicKey);
    verifier.update(message, 0, message.length);
    return verifier.verifySignature(signature);
  }

  static boolean isSmallOrder(byte[] encoding) {
    for (byte[] candidate : SMALL_ORDER_ENCODINGS) {
      if (Arrays.equals(candidate, encoding)) {
        return true;
      }
    }
    return false;
  }

  private static byte[][] decodeAll(String... hex) {
    byte[][] out = new byte[hex.length][];
    for (int i = 0; i < hex.length; i++) {
      out[i] = HexFormat.of().parseHex(hex[i]);
    }
    return out;
  }
}
