package com.pausaler.licensor.issuer.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.pausaler.licensor.issuer.IssuerFixtures;
import com.pausaler.licensor.issuer.config.IssuerConfig;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IssuerCliTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00.400Z"), ZoneOffset.UTC);

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  @Test
  void generate_lifetime() {
    int status = run(Map.of(), "generate", "--activation-code", IssuerFixtures.ACTIVATION_CODE, "--type", "lifetime");

    assertThat(status).isEqualTo(IssuerCli.EXIT_OK);
    assertThat(stdout()).isEqualTo(IssuerFixtures.LIFETIME_LICENSE + System.lineSeparator());
  }

  @Test
  void generate_yearly_equalsSyntax() {
    int status = run(Map.of(), "generate", "--type=YEARLY", "--activation-code=" + IssuerFixtures.ACTIVATION_CODE);

    assertThat(status).isEqualTo(IssuerCli.EXIT_OK);
    assertThat(stdout().trim()).isEqualTo(IssuerFixtures.YEARLY_LICENSE);
  }

  @Test
  void generate_unknownType() {
    int status = run(Map.of(), "generate", "--activation-code", IssuerFixtures.ACTIVATION_CODE, "--type", "monthly");

    assertThat(status).isEqualTo(IssuerCli.EXIT_FAILURE);
    assertThat(stdout()).isEmpty();
    assertThat(stderr()).startsWith("Error: Unknown license type: monthly").contains("Valid values: yearly, lifetime");
  }

  @Test
  void generate_rejectedActivationCode() {
    int status = run(Map.of(IssuerConfig.APP_ID_ENV, "other.app"),
        "generate", "--activation-code", IssuerFixtures.ACTIVATION_CODE, "--type", "lifetime");

    assertThat(status).isEqualTo(IssuerCli.EXIT_FAILURE);
    assertThat(stdout()).isEmpty();
    assertThat(stderr()).contains("Error: activation code app_id mismatch: expected other.app");
  }

  @Test
  void generate_missingArguments() {
    assertThat(run(Map.of(), "generate", "--type", "lifetime")).isEqualTo(IssuerCli.EXIT_FAILURE);
    assertThat(stderr()).contains("Usage");
    assertThat(stdout()).isEmpty();
  }

  @Test
  void generate_unexpectedArgument() {
    assertThat(run(Map.of(), "generate", "--seats", "5")).isEqualTo(IssuerCli.EXIT_FAILURE);
    assertThat(stderr()).contains("Unexpected argument: --seats");
  }

  @Test
  void publicKey_printsPem() {
    assertThat(run(Map.of(), "public-key")).isEqualTo(IssuerCli.EXIT_OK);
    assertThat(stdout()).isEqualTo(IssuerFixtures.DEV_PUBLIC_KEY_PEM);
  }

  @Test
  void publicKey_usesConfiguredSeed() {
    assertThat(run(Map.of(IssuerConfig.SEED_ENV, "42".repeat(32)), "public-key")).isEqualTo(IssuerCli.EXIT_OK);
    assertThat(stdout()).startsWith("-----BEGIN PUBLIC KEY-----").isNotEqualTo(IssuerFixtures.DEV_PUBLIC_KEY_PEM);
  }

  @Test
  void badSeed_isReported() {
    assertThat(run(Map.of(IssuerConfig.SEED_ENV, "not-hex"), "public-key")).isEqualTo(IssuerCli.EXIT_FAILURE);
    assertThat(stderr()).contains("Error: " + IssuerConfig.SEED_ENV + " must be hex-encoded");
  }

  @Test
  void noArguments_printsUsage() {
    assertThat(run(Map.of())).isEqualTo(IssuerCli.EXIT_FAILURE);
    assertThat(stderr()).contains("Usage");
  }

  @Test
  void unknownCommand() {
    assertThat(run(Map.of(), "revoke")).isEqualTo(IssuerCli.EXIT_FAILURE);
    assertThat(stderr()).contains("Unknown command: revoke");
  }

  private int run(Map<String, String> env, String... args) {
    return new IssuerCli(env, CLOCK).run(args,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String stderr() {
    return err.toString(StandardCharsets.UTF_8);
  }
}
