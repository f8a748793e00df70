package com.codeheadsystems.secagg.model.round;

import com.codeheadsystems.secagg.config.RoundPolicy;
import com.codeheadsystems.secagg.privacy.PrivacyBudget;
import com.codeheadsystems.secagg.privacy.QuantizationBits;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Server's round parameters: { epsilon, sensitivity, deltaDP, clipNorm, quantizationBits, threshold }.
 *
 * @param epsilon          privacy loss per round
 * @param sensitivity      L2 sensitivity used to calibrate the noise
 * @param deltaDP          failure probability of the Gaussian mechanism
 * @param clipNorm         maximum L2 norm of a client delta
 * @param quantizationBits 8 or 16
 * @param threshold        shares needed to rebuild a mask seed
 */
public record RoundPolicyResponse(@JsonProperty("epsilon") double epsilon,
                                  @JsonProperty("sensitivity") double sensitivity,
                                  @JsonProperty("deltaDP") double deltaDP,
                                  @JsonProperty("clipNorm") double clipNorm,
                                  @JsonProperty("quantizationBits") int quantizationBits,
                                  @JsonProperty("threshold") int threshold) {

  public static RoundPolicyResponse from(RoundPolicy policy) {
    PrivacyBudget budget = policy.budget();
    return new RoundPolicyResponse(budget.epsilon(), budget.sensitivity(), budget.deltaDP(),
        policy.clipNorm(), policy.quantizationBits().bits(), policy.threshold());
  }

  /**
   * Validates the fields by building the core policy.
   *
   * @return the round policy
   * @throws IllegalArgumentException if any value is out of range
   */
  public RoundPolicy toRoundPolicy() {
    return new RoundPolicy(
        new PrivacyBudget(epsilon, sensitivity, deltaDP),
        clipNorm,
        QuantizationBits.fromBits(quantizationBits),
        threshold);
  }
}
