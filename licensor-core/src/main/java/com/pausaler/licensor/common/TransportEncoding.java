package com.pausaler.licensor.common;

import com.pausaler.licensor.exceptions.ErrorKind;
import com.pausaler.licensor.exceptions.LicenseException;
import java.util.Base64;

/**
 * Unpadded base64url, the transport encoding of license strings and activation codes.
 */
public class TransportEncoding {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private TransportEncoding() {
  }

  /**
   * Encodes bytes as unpadded base64url.
   *
   * @param bytes the bytes
   * @return the encoded string
   */
  public static String encode(byte[] bytes) {
    return ENCODER.encodeToString(bytes);
  }

  /**
   * Decodes unpadded base64url. Padding characters, characters outside the URL-safe alphabet and
   * non-zero trailing bits are all rejected.
   *
   * @param value the encoded string
   * @return the decoded bytes
   * @throws LicenseException with {@link ErrorKind#MALFORMED_ENCODING} if the value is not canonical
   */
  public static byte[] decode(String value) {
    if (value == null) {
      throw new LicenseException(ErrorKind.MALFORMED_ENCODING, "base64url decode failed: null input");
    }
    if (value.indexOf('=') >= 0) {
      throw new LicenseException(ErrorKind.MALFORMED_ENCODING, "base64url decode failed: padding is not allowed");
    }
    final byte[] decoded;
    try {
      decoded = DECODER.decode(value);
    } catch (IllegalArgumentException e) {
      throw new LicenseException(ErrorKind.MALFORMED_ENCODING, "base64url decode failed: " + e.getMessage(), e);
    }
    // The JDK decoder ignores trailing bits in the final symbol.
    if (!ENCODER.encodeToString(decoded).equals(value)) {
      throw new LicenseException(ErrorKind.MALFORMED_ENCODING, "base64url decode failed: invalid last symbol");
    }
    return decoded;
  }
}
