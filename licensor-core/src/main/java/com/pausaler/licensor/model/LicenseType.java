package com.pausaler.licensor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Map;

/**
 * License class. The wire names are fixed by the license format and mapped explicitly rather than
 * derived from the constant names.
 */
public enum LicenseType {
  YEARLY("YEARLY"),
  LIFETIME("LIFETIME");

  private static final Map<String, LicenseType> BY_WIRE_NAME = Map.of(
      "YEARLY", YEARLY,
      "LIFETIME", LIFETIME
  );

  private final String wireName;

  LicenseType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * The name used in the signed payload.
   *
   * @return the wire name
   */
  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Maps a payload value back to the license type. Exact match only.
   *
   * @param wireName the wire name
   * @return the license type
   * @throws IllegalArgumentException for unknown names
   */
  @JsonCreator
  public static LicenseType fromWireName(String wireName) {
    LicenseType type = wireName == null ? null : BY_WIRE_NAME.get(wireName);
    if (type == null) {
      throw new IllegalArgumentException("Unknown license type: " + wireName);
    }
    return type;
  }

  /**
   * Case-insensitive lookup for operator input such as {@code yearly} or {@code Lifetime}.
   *
   * @param name the name
   * @return the license type
   * @throws IllegalArgumentException for unknown names
   */
  public static LicenseType fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("License type is missing. Valid values: yearly, lifetime");
    }
    LicenseType type = BY_WIRE_NAME.get(name.trim().toUpperCase(Locale.ROOT));
    if (type == null) {
      throw new IllegalArgumentException("Unknown license type: " + name + ". Valid values: yearly, lifetime");
    }
    return type;
  }
}
