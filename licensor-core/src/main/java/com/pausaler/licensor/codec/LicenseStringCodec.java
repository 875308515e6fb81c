package com.pausaler.licensor.codec;

import com.pausaler.licensor.common.TransportEncoding;
import java.util.Optional;

/**
 * The license string wire format: {@code B64URL(payload) "." B64URL(signature)}.
 */
public class LicenseStringCodec {

  /**
   * Separator between the payload and signature segments.
   */
  public static final char SEPARATOR = '.';

  private LicenseStringCodec() {
  }

  /**
   * Joins already-signed payload bytes and their signature.
   *
   * @param payloadBytes   the exact bytes that were signed
   * @param signatureBytes the signature
   * @return the license string
   */
  public static String join(byte[] payloadBytes, byte[] signatureBytes) {
    return TransportEncoding.encode(payloadBytes) + SEPARATOR + TransportEncoding.encode(signatureBytes);
  }

  /**
   * Splits a license string into its two encoded segments. Segments are not decoded here.
   *
   * @param license the license string
   * @return the segments, or empty when there are not exactly two
   */
  public static Optional<Segments> split(String license) {
    if (license == null) {
      return Optional.empty();
    }
    String[] parts = license.split("\\.", -1);
    if (parts.length != 2) {
      return Optional.empty();
    }
    return Optional.of(new Segments(parts[0], parts[1]));
  }

  /**
   * The two transport-encoded segments of a license string.
   *
   * @param payload   encoded payload
   * @param signature encoded signature
   */
  public record Segments(String payload, String signature) {

    public byte[] payloadBytes() {
      return TransportEncoding.decode(payload);
    }

    public byte[] signatureBytes() {
      return TransportEncoding.decode(signature);
    }
  }
}
