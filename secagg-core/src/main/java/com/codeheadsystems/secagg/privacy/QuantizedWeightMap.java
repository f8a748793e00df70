package com.codeheadsystems.secagg.privacy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tensor name to {@link QuantizedTensor}, in insertion order.
 *
 * @param tensors the tensors
 */
public record QuantizedWeightMap(Map<String, QuantizedTensor> tensors) {

  public QuantizedWeightMap {
    tensors = Collections.unmodifiableMap(new LinkedHashMap<>(tensors));
  }

  /**
   * The named tensor.
   *
   * @param name the name
   * @return the quantized tensor
   * @throws IllegalArgumentException if no tensor has that name
   */
  public QuantizedTensor tensor(String name) {
    QuantizedTensor tensor = tensors.get(name);
    if (tensor == null) {
      throw new IllegalArgumentException("Unknown tensor: " + name);
    }
    return tensor;
  }

  public int size() {
    return tensors.size();
  }
}
