package com.codeheadsystems.secagg.config;

import com.codeheadsystems.secagg.privacy.PrivacyBudget;
import com.codeheadsystems.secagg.privacy.QuantizationBits;
import java.util.Objects;

/**
 * Server-issued parameters for one aggregation round.
 *
 * @param budget           noise calibration
 * @param clipNorm         maximum L2 norm of a client delta
 * @param quantizationBits width used when a delta is compressed
 * @param threshold        minimum number of shares needed to recover a mask seed
 */
public record RoundPolicy(PrivacyBudget budget, double clipNorm, QuantizationBits quantizationBits,
                          int threshold) {

  /**
   * epsilon 1.0, sensitivity 1.0, deltaDP 1e-5, clip norm 1.0, 8-bit, threshold 2.
   */
  public static final RoundPolicy DEFAULT = new RoundPolicy(
      new PrivacyBudget(1.0, 1.0, 1e-5), 1.0, QuantizationBits.EIGHT, 2);

  public RoundPolicy {
    Objects.requireNonNull(budget, "budget");
    Objects.requireNonNull(quantizationBits, "quantizationBits");
    if (!(clipNorm >= 0)) {
      throw new IllegalArgumentException("clipNorm must be non-negative, got " + clipNorm);
    }
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be at least 1, got " + threshold);
    }
  }
}
