package com.codeheadsystems.secagg.exceptions;

/**
 * Thrown when two weight maps (or a weight map and a mask) disagree on the length of a tensor
 * they share, or when a required tensor is missing.
 */
public class DimensionMismatchException extends IllegalArgumentException {

  private final String key;

  /**
   * Instantiates a new Dimension mismatch exception.
   *
   * @param key      the offending tensor name
   * @param expected the expected length, or -1 when the tensor is missing
   * @param actual   the actual length, or -1 when the tensor is missing
   */
  public DimensionMismatchException(final String key, final int expected, final int actual) {
    super(expected < 0 || actual < 0
        ? "Weight dimension mismatch for \"" + key + "\": tensor missing"
        : "Weight dimension mismatch for \"" + key + "\": expected " + expected + ", got " + actual);
    this.key = key;
  }

  /**
   * The tensor name that failed the check.
   *
   * @return the key
   */
  public String key() {
    return key;
  }
}
