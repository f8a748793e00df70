package com.codeheadsystems.secagg.model.update;

import com.codeheadsystems.secagg.model.WireFields;
import com.codeheadsystems.secagg.weights.WeightMap;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire model for a client's (usually masked) weight update.
 * <p>
 * Carries one {@link TensorPayload} per tensor, keyed by tensor name in the client's order, plus
 * optional training metrics. The same shape is used by survivors to report dropout corrections.
 *
 * @param deviceId the submitting device
 * @param delta    payload per tensor name
 * @param metrics  optional numeric metrics, omitted from JSON when null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WeightUpdateSubmission(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("delta") Map<String, TensorPayload> delta,
    @JsonProperty("metrics") Map<String, Double> metrics) {

  public static WeightUpdateSubmission from(String deviceId, WeightMap update) {
    return from(deviceId, update, null);
  }

  /**
   * Serializes a weight map tensor by tensor.
   *
   * @param deviceId the device id
   * @param update   the update
   * @param metrics  optional metrics
   * @return the weight update submission
   */
  public static WeightUpdateSubmission from(String deviceId, WeightMap update, Map<String, Double> metrics) {
    Map<String, TensorPayload> payloads = new LinkedHashMap<>();
    update.forEach((name, values) -> payloads.put(name, TensorPayload.from(values)));
    return new WeightUpdateSubmission(deviceId, payloads, metrics);
  }

  /**
   * @return the update as a weight map, in wire order
   * @throws IllegalArgumentException if a field is missing or a shape does not match its data
   */
  public WeightMap toWeightMap() {
    WireFields.require(deviceId, "device_id");
    WireFields.require(delta, "delta");
    WeightMap.Builder builder = WeightMap.builder();
    delta.forEach((name, payload) -> builder.put(name, WireFields.require(payload, "delta." + name).toArray(name)));
    return builder.build();
  }
}
