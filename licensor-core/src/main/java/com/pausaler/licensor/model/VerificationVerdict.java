package com.pausaler.licensor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Result of a verification that reached a decision.
 * <p>
 * On a {@link VerdictReason#PIB_MISMATCH} verdict the type and expiry come from a payload whose
 * signature was never checked. They are display hints only and must not drive feature gating.
 *
 * @param licenseType wire name of the license type, null for an unparseable format
 * @param validUntil  RFC 3339 expiry, null for lifetime licenses
 * @param valid       whether the license grants access now
 * @param reason      why it does not, null when valid
 */
@JsonPropertyOrder({"license_type", "valid_until", "is_valid", "reason"})
public record VerificationVerdict(
    @JsonProperty("license_type") String licenseType,
    @JsonProperty("valid_until") String validUntil,
    @JsonProperty("is_valid") boolean valid,
    @JsonProperty("reason") VerdictReason reason) {

  public static VerificationVerdict valid(LicenseType type, String validUntil) {
    return new VerificationVerdict(type.wireName(), validUntil, true, null);
  }

  public static VerificationVerdict invalid(VerdictReason reason, LicenseType type, String validUntil) {
    return new VerificationVerdict(type == null ? null : type.wireName(), validUntil, false, reason);
  }

  public static VerificationVerdict invalidFormat() {
    return new VerificationVerdict(null, null, false, VerdictReason.INVALID_FORMAT);
  }
}
