package com.pausaler.licensor.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class NonceGeneratorTest {

  @Test
  void nonce_hasFixedLength() {
    assertThat(new NonceGenerator().nonce()).hasSize(NonceGenerator.NONCE_LENGTH);
  }

  @Test
  void nonce_differsEachCall() {
    NonceGenerator generator = new NonceGenerator();
    assertThat(generator.nonce()).isNotEqualTo(generator.nonce());
  }

  @Test
  void nonce_drawsFromGivenRandom() {
    SecureRandom random = new SecureRandom() {
      @Override
      public void nextBytes(byte[] bytes) {
        for (int i = 0; i < bytes.length; i++) {
          bytes[i] = (byte) i;
        }
      }
    };

    assertThat(TransportEncoding.encode(new NonceGenerator(random).nonce())).isEqualTo("AAECAwQFBgcICQoLDA0ODw");
  }
}
