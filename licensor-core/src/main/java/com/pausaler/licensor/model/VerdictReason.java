package com.pausaler.licensor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a well-formed license is not currently valid. These are expected states the user can act on.
 */
public enum VerdictReason {
  INVALID_FORMAT("invalid_format"),
  PIB_MISMATCH("pib_mismatch"),
  NOT_YET_VALID("not_yet_valid"),
  EXPIRED("expired");

  private final String wireName;

  VerdictReason(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
