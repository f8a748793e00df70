package com.codeheadsystems.secagg.common;

import java.math.BigInteger;

/**
 * Utility methods for octet string encoding.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Converts a non-negative integer to a big-endian octet string of specified length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(int value, int length) {
    if (value < 0 || (length < 4 && value >= (1 << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Reads a 32-bit unsigned little-endian word starting at {@code offset}.
   *
   * @param bytes  the source
   * @param offset index of the least significant byte
   * @return the word as a non-negative long
   */
  public static long readUint32LE(byte[] bytes, int offset) {
    return (bytes[offset] & 0xFFL)
        | (bytes[offset + 1] & 0xFFL) << 8
        | (bytes[offset + 2] & 0xFFL) << 16
        | (bytes[offset + 3] & 0xFFL) << 24;
  }

  /**
   * Encodes a non-negative scalar as a fixed-width big-endian array, stripping the BigInteger
   * sign byte or left-padding with zeros as needed.
   *
   * @param k      the scalar
   * @param length the output width
   * @return the byte [ ]
   */
  public static byte[] toFixedLength(BigInteger k, int length) {
    if (k.signum() < 0) {
      throw new IllegalArgumentException("Scalar must be non-negative");
    }
    byte[] raw = k.toByteArray();
    if (raw.length == length) {
      return raw;
    }
    byte[] out = new byte[length];
    if (raw.length > length) {
      if (raw.length - length > 1 || raw[0] != 0) {
        throw new IllegalArgumentException("Scalar does not fit in " + length + " bytes");
      }
      System.arraycopy(raw, raw.length - length, out, 0, length);
    } else {
      System.arraycopy(raw, 0, out, length - raw.length, raw.length);
    }
    return out;
  }
}
