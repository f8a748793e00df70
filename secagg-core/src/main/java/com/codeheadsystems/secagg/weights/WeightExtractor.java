package com.codeheadsystems.secagg.weights;

import com.codeheadsystems.secagg.exceptions.DimensionMismatchException;
import java.util.List;
import java.util.Map;

/**
 * Element-wise arithmetic over {@link WeightMap}s. Every result is a fresh map.
 */
public class WeightExtractor {

  private WeightExtractor() {
  }

  /**
   * {@code delta = after - before} for every tensor of {@code before}. Tensors present only in
   * {@code after} are ignored.
   *
   * @param before weights before the training step
   * @param after  weights after the training step
   * @return the weight delta
   * @throws DimensionMismatchException if a tensor is missing from {@code after} or the lengths differ
   */
  public static WeightDelta computeDelta(WeightMap before, WeightMap after) {
    WeightMap.Builder builder = WeightMap.builder();
    for (Map.Entry<String, float[]> entry : before.rawTensors().entrySet()) {
      String key = entry.getKey();
      float[] b = entry.getValue();
      float[] a = after.raw(key);
      if (a == null) {
        throw new DimensionMismatchException(key, b.length, -1);
      }
      if (a.length != b.length) {
        throw new DimensionMismatchException(key, b.length, a.length);
      }
      float[] d = new float[b.length];
      for (int i = 0; i < b.length; i++) {
        d[i] = a[i] - b[i];
      }
      builder.putOwned(key, d);
    }
    return builder.buildDelta();
  }

  /**
   * {@code result = weights + delta}. Tensors with no delta are copied through.
   *
   * @param weights the weights
   * @param delta   the delta
   * @return the weight map
   * @throws DimensionMismatchException if a shared tensor differs in length
   */
  public static WeightMap applyDelta(WeightMap weights, WeightMap delta) {
    WeightMap.Builder builder = WeightMap.builder();
    for (Map.Entry<String, float[]> entry : weights.rawTensors().entrySet()) {
      String key = entry.getKey();
      float[] w = entry.getValue();
      float[] d = delta.raw(key);
      if (d == null) {
        builder.put(key, w);
        continue;
      }
      if (d.length != w.length) {
        throw new DimensionMismatchException(key, w.length, d.length);
      }
      float[] r = new float[w.length];
      for (int i = 0; i < w.length; i++) {
        r[i] = w[i] + d[i];
      }
      builder.putOwned(key, r);
    }
    return builder.build();
  }

  /**
   * L2 norm of all elements, flattened across tensors.
   *
   * @param weights the weights
   * @return the double
   */
  public static double l2Norm(WeightMap weights) {
    double sumSq = 0;
    for (float[] values : weights.rawTensors().values()) {
      for (float v : values) {
        sumSq += (double) v * v;
      }
    }
    return Math.sqrt(sumSq);
  }

  /**
   * Element-wise sum of maps that share the same tensor names and lengths.
   *
   * @param maps at least one map
   * @return the weight map
   * @throws DimensionMismatchException if a map lacks a tensor of the first map or has a different length
   */
  public static WeightMap sum(List<? extends WeightMap> maps) {
    if (maps.isEmpty()) {
      throw new IllegalArgumentException("Cannot sum an empty list of weight maps");
    }
    WeightMap first = maps.get(0);
    WeightMap.Builder builder = WeightMap.builder();
    for (Map.Entry<String, float[]> entry : first.rawTensors().entrySet()) {
      String key = entry.getKey();
      float[] acc = entry.getValue().clone();
      for (int m = 1; m < maps.size(); m++) {
        float[] next = maps.get(m).raw(key);
        if (next == null) {
          throw new DimensionMismatchException(key, acc.length, -1);
        }
        if (next.length != acc.length) {
          throw new DimensionMismatchException(key, acc.length, next.length);
        }
        for (int i = 0; i < acc.length; i++) {
          acc[i] += next[i];
        }
      }
      builder.putOwned(key, acc);
    }
    return builder.build();
  }

  /**
   * Element-wise {@code sign * mask} added to a copy of {@code base}, for tensors present in
   * {@code masks}. Shared by the masking transforms.
   *
   * @param base  the values
   * @param masks per-tensor masks
   * @param sign  +1 to add, -1 to subtract
   * @return the weight map
   */
  public static WeightMap addScaled(WeightMap base, WeightMap masks, float sign) {
    WeightMap.Builder builder = WeightMap.builder();
    for (Map.Entry<String, float[]> entry : base.rawTensors().entrySet()) {
      String key = entry.getKey();
      float[] result = entry.getValue().clone();
      float[] mask = masks.raw(key);
      if (mask != null) {
        if (mask.length != result.length) {
          throw new DimensionMismatchException(key, result.length, mask.length);
        }
        for (int i = 0; i < result.length; i++) {
          result[i] = result[i] + sign * mask[i];
        }
      }
      builder.putOwned(key, result);
    }
    return builder.build();
  }
}
