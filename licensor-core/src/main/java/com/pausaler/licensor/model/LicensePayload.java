package com.pausaler.licensor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.pausaler.licensor.common.Rfc3339;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * The signed license claims as produced by the issuer.
 * <p>
 * Field order and the omission of an absent {@code valid_until} are part of the signed byte layout.
 *
 * @param licenseType license class
 * @param validFrom   RFC 3339 start of validity, second precision
 * @param validUntil  RFC 3339 end of validity; present if and only if the type is YEARLY
 * @param pibHash     identifier hash the license is bound to
 */
@JsonPropertyOrder({"license_type", "valid_from", "valid_until", "pib_hash"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LicensePayload(
    @JsonProperty("license_type") LicenseType licenseType,
    @JsonProperty("valid_from") String validFrom,
    @JsonProperty("valid_until") String validUntil,
    @JsonProperty("pib_hash") String pibHash) {

  /**
   * A yearly license lasts a fixed 365 days, with no calendar adjustment.
   */
  public static final Duration YEARLY_TERM = Duration.ofDays(365);

  public LicensePayload {
    if (licenseType == null || validFrom == null || pibHash == null) {
      throw new IllegalArgumentException("license_type, valid_from and pib_hash are required");
    }
    if ((licenseType == LicenseType.YEARLY) != (validUntil != null)) {
      throw new IllegalArgumentException("valid_until must be present exactly for YEARLY licenses");
    }
  }

  /**
   * Builds a yearly payload starting at {@code validFrom}, truncated to whole seconds.
   *
   * @param validFrom start of validity
   * @param pibHash   bound identifier hash
   * @return the payload
   */
  public static LicensePayload yearly(Instant validFrom, String pibHash) {
    Instant from = validFrom.truncatedTo(ChronoUnit.SECONDS);
    return new LicensePayload(LicenseType.YEARLY, Rfc3339.format(from), Rfc3339.format(from.plus(YEARLY_TERM)),
        pibHash);
  }

  /**
   * Builds a lifetime payload starting at {@code validFrom}, truncated to whole seconds.
   *
   * @param validFrom start of validity
   * @param pibHash   bound identifier hash
   * @return the payload
   */
  public static LicensePayload lifetime(Instant validFrom, String pibHash) {
    return new LicensePayload(LicenseType.LIFETIME, Rfc3339.format(validFrom), null, pibHash);
  }

  /**
   * Builds a payload of the given type.
   *
   * @param type      the license type
   * @param validFrom start of validity
   * @param pibHash   bound identifier hash
   * @return the payload
   */
  public static LicensePayload of(LicenseType type, Instant validFrom, String pibHash) {
    return switch (type) {
      case YEARLY -> yearly(validFrom, pibHash);
      case LIFETIME -> lifetime(validFrom, pibHash);
    };
  }
}
