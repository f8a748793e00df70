package com.codeheadsystems.secagg.privacy;

/**
 * Supported widths for symmetric quantization.
 */
public enum QuantizationBits {
  EIGHT(8, 127),
  SIXTEEN(16, 32767);

  private final int bits;
  private final int maxRepresentable;

  QuantizationBits(int bits, int maxRepresentable) {
    this.bits = bits;
    this.maxRepresentable = maxRepresentable;
  }

  /**
   * Returns the width for the given bit count. Accepted values: 8, 16.
   *
   * @param bits the bits
   * @return the quantization bits
   * @throws IllegalArgumentException for any other width
   */
  public static QuantizationBits fromBits(int bits) {
    return switch (bits) {
      case 8 -> EIGHT;
      case 16 -> SIXTEEN;
      default -> throw new IllegalArgumentException("Unsupported quantization width: " + bits
          + ". Valid values: 8, 16");
    };
  }

  public int bits() {
    return bits;
  }

  public int maxRepresentable() {
    return maxRepresentable;
  }
}
