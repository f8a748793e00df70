package com.codeheadsystems.secagg.model;

import java.util.Base64;

/**
 * Field helpers shared by the wire records. Every failure names the offending JSON field.
 */
public final class WireFields {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private WireFields() {
  }

  public static String encodeBase64(byte[] bytes) {
    return B64.encodeToString(bytes);
  }

  /**
   * Decodes a required base64 field.
   *
   * @param encoded   the field value
   * @param fieldName JSON name used in the error message
   * @return the decoded bytes
   * @throws IllegalArgumentException if the field is missing, blank or not base64
   */
  public static byte[] decodeBase64(String encoded, String fieldName) {
    if (encoded == null || encoded.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  /**
   * @param value     the field value
   * @param fieldName JSON name used in the error message
   * @param <T>       the field type
   * @return the value
   * @throws IllegalArgumentException if the value is null
   */
  public static <T> T require(T value, String fieldName) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    return value;
  }
}
