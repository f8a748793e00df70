package com.codeheadsystems.secagg.model.update;

import com.codeheadsystems.secagg.model.WireFields;
import com.codeheadsystems.secagg.privacy.QuantizationBits;
import com.codeheadsystems.secagg.privacy.QuantizedTensor;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param data      quantized values
 * @param scale     dequantization multiplier
 * @param zeroPoint always 0
 * @param bits      8 or 16
 */
public record QuantizedTensorPayload(@JsonProperty("data") short[] data,
                                     @JsonProperty("scale") double scale,
                                     @JsonProperty("zeroPoint") int zeroPoint,
                                     @JsonProperty("bits") int bits) {

  public static QuantizedTensorPayload from(QuantizedTensor tensor) {
    return new QuantizedTensorPayload(tensor.data(), tensor.scale(), tensor.zeroPoint(), tensor.bits().bits());
  }

  /**
   * @param name tensor name, for error messages
   * @return the core tensor
   * @throws IllegalArgumentException if data is missing, the width is unsupported or a value does
   *                                  not fit the width
   */
  public QuantizedTensor toQuantizedTensor(String name) {
    WireFields.require(data, "delta." + name + ".data");
    QuantizationBits width = QuantizationBits.fromBits(bits);
    for (short q : data) {
      if (Math.abs(q) > width.maxRepresentable()) {
        throw new IllegalArgumentException("Value " + q + " in delta." + name + " exceeds " + bits + "-bit range");
      }
    }
    return new QuantizedTensor(data, scale, zeroPoint, width);
  }
}
