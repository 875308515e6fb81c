package com.pausaler.licensor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * License claims as parsed from an incoming license string, before any check has run.
 * No invariants are enforced here so that the verifier can report structural problems in its own order.
 *
 * @param licenseType license class
 * @param validFrom   RFC 3339 start of validity
 * @param validUntil  RFC 3339 end of validity, may be null
 * @param pibHash     bound identifier hash
 */
public record ReceivedLicensePayload(
    @JsonProperty("license_type") LicenseType licenseType,
    @JsonProperty("valid_from") String validFrom,
    @JsonProperty("valid_until") String validUntil,
    @JsonProperty("pib_hash") String pibHash) {
}
