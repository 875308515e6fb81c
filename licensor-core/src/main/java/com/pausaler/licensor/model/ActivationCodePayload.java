package com.pausaler.licensor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Unsigned activation request emitted by a user's installation.
 *
 * @param pibHash  identifier hash to bind the license to
 * @param issuedAt Unix seconds at generation, boxed so that a missing value is distinguishable from zero
 * @param nonce    base64url of 16 random bytes
 * @param appId    product identifier of the requesting application
 */
@JsonPropertyOrder({"pib_hash", "issued_at", "nonce", "app_id"})
public record ActivationCodePayload(
    @JsonProperty("pib_hash") String pibHash,
    @JsonProperty("issued_at") Long issuedAt,
    @JsonProperty("nonce") String nonce,
    @JsonProperty("app_id") String appId) {
}
