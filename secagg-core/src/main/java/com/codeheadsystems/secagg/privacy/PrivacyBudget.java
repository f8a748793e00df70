package com.codeheadsystems.secagg.privacy;

/**
 * Parameters of the Gaussian mechanism for (epsilon, delta)-differential privacy.
 *
 * @param epsilon     privacy loss, strictly positive
 * @param sensitivity L2 sensitivity, non-negative (typically the clipping norm)
 * @param deltaDP     failure probability, in (0, 1)
 */
public record PrivacyBudget(double epsilon, double sensitivity, double deltaDP) {

  public PrivacyBudget {
    if (!(epsilon > 0) || Double.isInfinite(epsilon)) {
      throw new IllegalArgumentException("epsilon must be strictly positive, got " + epsilon);
    }
    if (!(sensitivity >= 0) || Double.isInfinite(sensitivity)) {
      throw new IllegalArgumentException("sensitivity must be non-negative, got " + sensitivity);
    }
    if (!(deltaDP > 0) || !(deltaDP < 1)) {
      throw new IllegalArgumentException("deltaDP must be in (0, 1), got " + deltaDP);
    }
  }

  /**
   * sigma = sensitivity * sqrt(2 * ln(1.25 / deltaDP)) / epsilon.
   *
   * @return the standard deviation of the per-element noise
   */
  public double noiseStdDev() {
    return sensitivity * Math.sqrt(2 * Math.log(1.25 / deltaDP)) / epsilon;
  }
}
