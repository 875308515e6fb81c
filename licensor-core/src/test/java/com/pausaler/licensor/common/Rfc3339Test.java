package com.pausaler.licensor.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pausaler.licensor.exceptions.ErrorKind;
import com.pausaler.licensor.exceptions.LicenseException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class Rfc3339Test {

  @Test
  void format_utcWithSecondPrecision() {
    assertThat(Rfc3339.format(Instant.parse("2025-01-01T00:00:00Z"))).isEqualTo("2025-01-01T00:00:00Z");
  }

  @Test
  void format_dropsSubSecondPrecision() {
    assertThat(Rfc3339.format(Instant.parse("2025-03-04T05:06:07.891Z"))).isEqualTo("2025-03-04T05:06:07Z");
  }

  @Test
  void parse_utc() {
    assertThat(Rfc3339.parse("2025-01-01T00:00:00Z")).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
  }

  @Test
  void parse_withOffset() {
    assertThat(Rfc3339.parse("2025-01-01T02:00:00+02:00")).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
  }

  @Test
  void parse_invalid_throwsInvalidTimestamp() {
    assertThatThrownBy(() -> Rfc3339.parse("2025-01-01"))
        .isInstanceOf(LicenseException.class)
        .satisfies(e -> assertThat(((LicenseException) e).kind()).isEqualTo(ErrorKind.INVALID_TIMESTAMP));
  }

  @Test
  void parse_fractionalSeconds() {
    assertThat(Rfc3339.parse("2025-01-01T00:00:00.5+01:00")).isEqualTo(Instant.parse("2024-12-31T23:00:00.5Z"));
  }

  @Test
  void parse_nonRfc3339Forms_throwInvalidTimestamp() {
    for (String value : new String[]{
        "2025-01-01T00:00Z",
        "2025-01-01T00:00:00",
        "2025-01-01T00:00:00+0100",
        "2025-01-01T00:00:00+01:00:00",
        "2025-02-30T00:00:00Z",
        "2025-01-01T00:00:00.Z"}) {
      assertThatThrownBy(() -> Rfc3339.parse(value))
          .as(value)
          .isInstanceOf(LicenseException.class)
          .satisfies(e -> assertThat(((LicenseException) e).kind()).isEqualTo(ErrorKind.INVALID_TIMESTAMP));
    }
  }

  @Test
  void parse_null_throwsInvalidTimestamp() {
    assertThatThrownBy(() -> Rfc3339.parse(null))
        .isInstanceOf(LicenseException.class)
        .satisfies(e -> assertThat(((LicenseException) e).kind()).isEqualTo(ErrorKind.INVALID_TIMESTAMP));
  }
}
