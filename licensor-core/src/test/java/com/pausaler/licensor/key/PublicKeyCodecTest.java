package com.pausaler.licensor.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pausaler.licensor.exceptions.ErrorKind;
import com.pausaler.licensor.exceptions.LicenseException;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class PublicKeyCodecTest {

  // Public key of the development signing seed, as printed by the issuer's public-key command.
  private static final String DEV_PUBLIC_KEY_HEX = "b44f7154de6c6c185824b6c9dbbf05ef5f2653e33dc0b55eec937373d4571d5e";
  private static final String DEV_PUBLIC_KEY_PEM = "-----BEGIN PUBLIC KEY-----\n"
      + "MCowBQYDK2VwAyEAtE9xVN5sbBhYJLbJ278F718mU+M9wLVe7JNzc9RXHV4=\n"
      + "-----END PUBLIC KEY-----\n";

  @Test
  void encode_knownKey() {
    assertThat(PublicKeyCodec.encode(HexFormat.of().parseHex(DEV_PUBLIC_KEY_HEX))).isEqualTo(DEV_PUBLIC_KEY_PEM);
  }

  @Test
  void decode_knownKey() {
    assertThat(PublicKeyCodec.decode(DEV_PUBLIC_KEY_PEM)).isEqualTo(HexFormat.of().parseHex(DEV_PUBLIC_KEY_HEX));
  }

  @Test
  void encodeThenDecode_returnsOriginalBytes() {
    byte[] key = new byte[32];
    Arrays.fill(key, (byte) 0x5a);
    assertThat(PublicKeyCodec.decode(PublicKeyCodec.encode(key))).isEqualTo(key);
  }

  @Test
  void decode_toleratesCrLfIndentationAndBlankLines() {
    String pem = "\r\n  -----BEGIN PUBLIC KEY-----\r\n"
        + "    MCowBQYDK2VwAyEAtE9xVN5sbBhYJLbJ278F\r\n"
        + "\r\n"
        + "    718mU+M9wLVe7JNzc9RXHV4=\r\n"
        + "  -----END PUBLIC KEY-----";
    assertThat(PublicKeyCodec.decode(pem)).isEqualTo(HexFormat.of().parseHex(DEV_PUBLIC_KEY_HEX));
  }

  @Test
  void decode_wrongLength_throwsUnsupportedKeyFormat() {
    byte[] der = new byte[PublicKeyCodec.DER_LENGTH + 1];
    System.arraycopy(PublicKeyCodec.SPKI_PREFIX, 0, der, 0, PublicKeyCodec.SPKI_PREFIX.length);
    assertUnsupported(wrap(der));
  }

  @Test
  void decode_truncated_throwsUnsupportedKeyFormat() {
    byte[] der = Arrays.copyOf(PublicKeyCodec.SPKI_PREFIX, PublicKeyCodec.SPKI_PREFIX.length + 31);
    assertUnsupported(wrap(der));
  }

  @Test
  void decode_wrongPrefix_throwsUnsupportedKeyFormat() {
    byte[] der = new byte[PublicKeyCodec.DER_LENGTH];
    System.arraycopy(PublicKeyCodec.SPKI_PREFIX, 0, der, 0, PublicKeyCodec.SPKI_PREFIX.length);
    der[8] = 0x6e; // OID 1.3.101.110 (X25519) instead of Ed25519
    assertUnsupported(wrap(der));
  }

  @Test
  void decode_notBase64_throwsUnsupportedKeyFormat() {
    assertUnsupported("-----BEGIN PUBLIC KEY-----\n***\n-----END PUBLIC KEY-----\n");
  }

  @Test
  void decode_null_throwsUnsupportedKeyFormat() {
    assertUnsupported(null);
  }

  @Test
  void encode_wrongKeyLength_throwsIAE() {
    assertThatThrownBy(() -> PublicKeyCodec.encode(new byte[31]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("32 bytes");
  }

  private static String wrap(byte[] der) {
    return "-----BEGIN PUBLIC KEY-----\n" + Base64.getEncoder().encodeToString(der) + "\n-----END PUBLIC KEY-----\n";
  }

  private static void assertUnsupported(String pem) {
    assertThatThrownBy(() -> PublicKeyCodec.decode(pem))
        .isInstanceOf(LicenseException.class)
        .satisfies(e -> assertThat(((LicenseException) e).kind()).isEqualTo(ErrorKind.UNSUPPORTED_KEY_FORMAT));
  }
}
