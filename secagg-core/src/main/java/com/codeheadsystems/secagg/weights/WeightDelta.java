package com.codeheadsystems.secagg.weights;

import java.util.Map;

/**
 * A {@link WeightMap} holding "after − before" for one local training step. Produced once by
 * {@link WeightExtractor#computeDelta(WeightMap, WeightMap)} (or a privacy transform) and consumed
 * once by masking.
 * <p>
 * A delta is never {@link #equals equal} to a plain {@link WeightMap}; wrap the map with
 * {@link #from(WeightMap)} first to compare contents.
 */
public final class WeightDelta extends WeightMap {

  WeightDelta(Map<String, float[]> tensors) {
    super(tensors);
  }

  /**
   * Treats the given weights as a delta. The arrays are copied.
   *
   * @param weights the weights
   * @return the weight delta
   */
  public static WeightDelta from(WeightMap weights) {
    if (weights instanceof WeightDelta delta) {
      return delta;
    }
    return new WeightDelta(weights.toMap());
  }

  /**
   * Single-tensor convenience.
   *
   * @param name   the name
   * @param values the values
   * @return the weight delta
   */
  public static WeightDelta of(String name, float... values) {
    return builder().put(name, values).buildDelta();
  }
}
