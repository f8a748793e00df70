package com.codeheadsystems.secagg.privacy;

import java.util.Arrays;
import java.util.Objects;

/**
 * One quantized tensor. 8-bit payloads are stored widened in a {@code short[]} but always lie in
 * [-127, 127].
 *
 * @param data      quantized values
 * @param scale     multiplier restoring the original magnitude
 * @param zeroPoint always 0 for symmetric quantization
 * @param bits      the width the values were quantized to
 */
public record QuantizedTensor(short[] data, double scale, int zeroPoint, QuantizationBits bits) {

  public QuantizedTensor {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(bits, "bits");
    if (!(scale > 0)) {
      throw new IllegalArgumentException("scale must be positive, got " + scale);
    }
    data = data.clone();
  }

  @Override
  public short[] data() {
    return data.clone();
  }

  public int length() {
    return data.length;
  }

  /**
   * Value at index {@code i} without copying the payload.
   *
   * @param i the index
   * @return the short
   */
  public short get(int i) {
    return data[i];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QuantizedTensor that)) {
      return false;
    }
    return Double.compare(that.scale, scale) == 0
        && zeroPoint == that.zeroPoint
        && bits == that.bits
        && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(data), scale, zeroPoint, bits);
  }

  @Override
  public String toString() {
    return "QuantizedTensor[length=" + data.length + ", scale=" + scale + ", zeroPoint=" + zeroPoint
        + ", bits=" + bits.bits() + "]";
  }
}
