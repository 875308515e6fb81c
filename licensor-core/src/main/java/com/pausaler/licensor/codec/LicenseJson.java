package com.pausaler.licensor.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.pausaler.licensor.exceptions.ErrorKind;
import com.pausaler.licensor.exceptions.LicenseException;
import com.pausaler.licensor.model.ActivationCodePayload;
import com.pausaler.licensor.model.LicensePayload;
import com.pausaler.licensor.model.ReceivedLicensePayload;
import java.io.IOException;

/**
 * JSON mapping for the closed payload shapes.
 * <p>
 * Output is compact with the field order declared on each record. Payload bytes are produced once,
 * signed, and from then on only ever handled as bytes.
 * <p>
 * Reading is strictly typed: a number is never accepted for a string field, nor a string or a
 * fraction for an integer field.
 */
public class LicenseJson {

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
      .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
      .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
      .withCoercionConfig(LogicalType.Textual, config -> config
          .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
          .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
          .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
      .build();

  private LicenseJson() {
  }

  /**
   * Serializes license claims into the bytes that get signed.
   *
   * @param payload the payload
   * @return compact UTF-8 JSON
   */
  public static byte[] canonicalBytes(LicensePayload payload) {
    return write(payload);
  }

  /**
   * Serializes an activation request.
   *
   * @param payload the payload
   * @return compact UTF-8 JSON
   */
  public static byte[] activationCodeBytes(ActivationCodePayload payload) {
    return write(payload);
  }

  /**
   * Parses license claims. The required fields {@code license_type}, {@code valid_from} and
   * {@code pib_hash} must be present; {@code valid_until} is checked later, against the license type.
   *
   * @param bytes decoded payload bytes
   * @return the parsed claims
   * @throws LicenseException with {@link ErrorKind#INVALID_PAYLOAD} if the bytes are not such a payload
   */
  public static ReceivedLicensePayload readPayload(byte[] bytes) {
    final ReceivedLicensePayload payload;
    try {
      payload = MAPPER.readValue(bytes, ReceivedLicensePayload.class);
    } catch (IOException e) {
      throw new LicenseException(ErrorKind.INVALID_PAYLOAD, "invalid payload json: " + e.getMessage(), e);
    }
    if (payload == null) {
      throw new LicenseException(ErrorKind.INVALID_PAYLOAD, "invalid payload json: null document");
    }
    requirePresent(payload.licenseType(), "license_type");
    requirePresent(payload.validFrom(), "valid_from");
    requirePresent(payload.pibHash(), "pib_hash");
    return payload;
  }

  /**
   * Parses an activation request without validating its fields.
   *
   * @param bytes decoded activation code bytes
   * @return the parsed payload, never null
   * @throws IOException if the bytes are not a JSON object of the expected shape
   */
  public static ActivationCodePayload readActivationCode(byte[] bytes) throws IOException {
    ActivationCodePayload payload = MAPPER.readValue(bytes, ActivationCodePayload.class);
    if (payload == null) {
      throw new IOException("null document");
    }
    return payload;
  }

  private static byte[] write(Object value) {
    try {
      return MAPPER.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  private static void requirePresent(Object value, String field) {
    if (value == null) {
      throw new LicenseException(ErrorKind.INVALID_PAYLOAD, "invalid payload json: missing field `" + field + "`");
    }
  }
}
