package com.codeheadsystems.secagg.model.update;

import com.codeheadsystems.secagg.model.WireFields;
import com.codeheadsystems.secagg.privacy.QuantizedTensor;
import com.codeheadsystems.secagg.privacy.QuantizedWeightMap;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire model for a compressed update produced by
 * {@link com.codeheadsystems.secagg.manager.ClientUpdateManager#compress}.
 *
 * @param deviceId the submitting device
 * @param delta    quantized payload per tensor name
 */
public record QuantizedUpdateSubmission(@JsonProperty("device_id") String deviceId,
                                        @JsonProperty("delta") Map<String, QuantizedTensorPayload> delta) {

  public static QuantizedUpdateSubmission from(String deviceId, QuantizedWeightMap quantized) {
    Map<String, QuantizedTensorPayload> payloads = new LinkedHashMap<>();
    quantized.tensors().forEach((name, tensor) -> payloads.put(name, QuantizedTensorPayload.from(tensor)));
    return new QuantizedUpdateSubmission(deviceId, payloads);
  }

  public QuantizedWeightMap toQuantizedWeightMap() {
    WireFields.require(deviceId, "device_id");
    WireFields.require(delta, "delta");
    Map<String, QuantizedTensor> tensors = new LinkedHashMap<>();
    delta.forEach((name, payload) ->
        tensors.put(name, WireFields.require(payload, "delta." + name).toQuantizedTensor(name)));
    return new QuantizedWeightMap(tensors);
  }
}
