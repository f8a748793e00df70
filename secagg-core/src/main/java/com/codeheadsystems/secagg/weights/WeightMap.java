package com.codeheadsystems.secagg.weights;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Immutable mapping from tensor name to a sequence of 32-bit floats. Represents either a full set
 * of model weights or a delta between two snapshots.
 * <p>
 * Arrays are copied on the way in and on the way out, so no stage of the clip / noise / quantize
 * / mask pipeline can observe or mutate another stage's values. Iteration follows insertion order.
 * <p>
 * Equality includes the runtime class: weights and deltas with the same tensors are not equal.
 */
public class WeightMap {

  private static final WeightMap EMPTY = new WeightMap(new LinkedHashMap<>());

  private final Map<String, float[]> tensors;

  /**
   * Takes ownership of an already-copied map. Callers go through {@link Builder}.
   *
   * @param tensors the tensors
   */
  WeightMap(Map<String, float[]> tensors) {
    this.tensors = tensors;
  }

  /**
   * Empty weight map.
   *
   * @return the weight map
   */
  public static WeightMap empty() {
    return EMPTY;
  }

  /**
   * Copies every array of the given map.
   *
   * @param tensors the tensors
   * @return the weight map
   */
  public static WeightMap of(Map<String, float[]> tensors) {
    Builder builder = builder();
    tensors.forEach(builder::put);
    return builder.build();
  }

  /**
   * Single-tensor convenience.
   *
   * @param name   the name
   * @param values the values
   * @return the weight map
   */
  public static WeightMap of(String name, float... values) {
    return builder().put(name, values).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Tensor names in insertion order.
   *
   * @return an unmodifiable view of the names
   */
  public Set<String> names() {
    return Collections.unmodifiableSet(tensors.keySet());
  }

  public boolean contains(String name) {
    return tensors.containsKey(name);
  }

  /**
   * A copy of the named tensor.
   *
   * @param name the name
   * @return the values
   * @throws IllegalArgumentException if no tensor has that name
   */
  public float[] tensor(String name) {
    float[] values = tensors.get(name);
    if (values == null) {
      throw new IllegalArgumentException("Unknown tensor: " + name);
    }
    return values.clone();
  }

  /**
   * Length of the named tensor, or -1 when absent.
   *
   * @param name the name
   * @return the length
   */
  public int length(String name) {
    float[] values = tensors.get(name);
    return values == null ? -1 : values.length;
  }

  /**
   * Number of tensors.
   *
   * @return the int
   */
  public int size() {
    return tensors.size();
  }

  public boolean isEmpty() {
    return tensors.isEmpty();
  }

  /**
   * Total number of scalar elements across all tensors.
   *
   * @return the long
   */
  public long elementCount() {
    long count = 0;
    for (float[] values : tensors.values()) {
      count += values.length;
    }
    return count;
  }

  /**
   * Visits each tensor with a copy of its values.
   *
   * @param consumer the consumer
   */
  public void forEach(BiConsumer<String, float[]> consumer) {
    tensors.forEach((name, values) -> consumer.accept(name, values.clone()));
  }

  /**
   * Copies all tensors into a new mutable map.
   *
   * @return the map
   */
  public Map<String, float[]> toMap() {
    Map<String, float[]> copy = new LinkedHashMap<>();
    tensors.forEach((name, values) -> copy.put(name, values.clone()));
    return copy;
  }

  /**
   * Same names and lengths as this map, every element zero.
   *
   * @return the weight map
   */
  public WeightMap zerosLike() {
    Builder builder = builder();
    tensors.forEach((name, values) -> builder.put(name, new float[values.length]));
    return builder.build();
  }

  /**
   * Direct read access for the transforms in this package. Never exposed outside it.
   */
  float[] raw(String name) {
    return tensors.get(name);
  }

  Map<String, float[]> rawTensors() {
    return tensors;
  }

  /**
   * Equal when the other object has the same runtime class and the same tensors. A
   * {@link WeightDelta} is therefore never equal to a plain {@code WeightMap}, even with identical
   * contents; use {@link WeightDelta#from(WeightMap)} to compare them as deltas.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Map<String, float[]> other = ((WeightMap) o).tensors;
    if (!tensors.keySet().equals(other.keySet())) {
      return false;
    }
    for (Map.Entry<String, float[]> entry : tensors.entrySet()) {
      if (!Arrays.equals(entry.getValue(), other.get(entry.getKey()))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (Map.Entry<String, float[]> entry : tensors.entrySet()) {
      hash += entry.getKey().hashCode() ^ Arrays.hashCode(entry.getValue());
    }
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
    boolean first = true;
    for (Map.Entry<String, float[]> entry : tensors.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(entry.getKey()).append("[").append(entry.getValue().length).append("]");
    }
    return sb.append('}').toString();
  }

  /**
   * Builder that copies every array it is given.
   */
  public static class Builder {

    private final Map<String, float[]> tensors = new LinkedHashMap<>();

    Builder() {
    }

    /**
     * Adds or replaces a tensor.
     *
     * @param name   the name
     * @param values the values, copied
     * @return the builder
     */
    public Builder put(String name, float[] values) {
      if (name == null || values == null) {
        throw new IllegalArgumentException("Tensor name and values are required");
      }
      tensors.put(name, values.clone());
      return this;
    }

    /**
     * Adds an array this package just allocated, without copying it again.
     */
    Builder putOwned(String name, float[] values) {
      tensors.put(name, values);
      return this;
    }

    public WeightMap build() {
      return new WeightMap(new LinkedHashMap<>(tensors));
    }

    public WeightDelta buildDelta() {
      return new WeightDelta(new LinkedHashMap<>(tensors));
    }
  }
}
