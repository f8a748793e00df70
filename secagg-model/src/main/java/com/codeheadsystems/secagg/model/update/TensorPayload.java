package com.codeheadsystems.secagg.model.update;

import com.codeheadsystems.secagg.model.WireFields;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One tensor on the wire: flat values plus the shape they came from. Deltas are flat, so the
 * shape written here is always {@code [data.length]}; any shape whose element count matches is
 * accepted on the way in.
 *
 * @param data  the values
 * @param shape dimensions, product equal to {@code data.length}
 */
public record TensorPayload(@JsonProperty("data") float[] data,
                            @JsonProperty("shape") int[] shape) {

  public static TensorPayload from(float[] values) {
    return new TensorPayload(values.clone(), new int[]{values.length});
  }

  /**
   * @param name tensor name, for error messages
   * @return a copy of the values
   * @throws IllegalArgumentException if data is missing or the shape does not match it
   */
  public float[] toArray(String name) {
    WireFields.require(data, "delta." + name + ".data");
    if (shape != null) {
      long count = 1;
      for (int dim : shape) {
        if (dim < 0) {
          throw new IllegalArgumentException("Negative dimension in delta." + name + ".shape");
        }
        count *= dim;
      }
      if (count != data.length) {
        throw new IllegalArgumentException("Shape of delta." + name + " holds " + count
            + " elements but data has " + data.length);
      }
    }
    return data.clone();
  }
}
