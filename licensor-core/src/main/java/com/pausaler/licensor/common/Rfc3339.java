package com.pausaler.licensor.common;

import com.pausaler.licensor.exceptions.ErrorKind;
import com.pausaler.licensor.exceptions.LicenseException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * RFC 3339 timestamps at second precision, as carried in license payloads.
 */
public class Rfc3339 {

  /**
   * {@code date-time} of RFC 3339 section 5.6: seconds required, optional fraction, {@code Z} or
   * {@code +hh:mm} offset.
   */
  private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendLiteral('T')
      .appendValue(ChronoField.HOUR_OF_DAY, 2)
      .appendLiteral(':')
      .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
      .appendLiteral(':')
      .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
      .optionalEnd()
      .appendOffset("+HH:MM", "Z")
      .toFormatter(Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT)
      .withChronology(IsoChronology.INSTANCE);

  private Rfc3339() {
  }

  /**
   * Formats an instant in UTC, e.g. {@code 2025-01-01T00:00:00Z}. Sub-second precision is dropped.
   *
   * @param instant the instant
   * @return the formatted timestamp
   */
  public static String format(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }

  /**
   * Parses an RFC 3339 timestamp. Forms ISO 8601 allows but RFC 3339 does not, such as a missing
   * seconds field, are rejected.
   *
   * @param value the timestamp
   * @return the instant
   * @throws LicenseException with {@link ErrorKind#INVALID_TIMESTAMP} if unparseable
   */
  public static Instant parse(String value) {
    if (value == null) {
      throw new LicenseException(ErrorKind.INVALID_TIMESTAMP, "invalid datetime: missing");
    }
    try {
      return OffsetDateTime.parse(value, PARSER).toInstant();
    } catch (DateTimeParseException e) {
      throw new LicenseException(ErrorKind.INVALID_TIMESTAMP, "invalid datetime: " + value, e);
    }
  }
}
