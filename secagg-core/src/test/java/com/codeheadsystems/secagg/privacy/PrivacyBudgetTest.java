package com.codeheadsystems.secagg.privacy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class PrivacyBudgetTest {

  @Test
  void noiseStdDev_followsGaussianMechanism() {
    PrivacyBudget budget = new PrivacyBudget(0.5, 2.0, 1e-5);

    double expected = 2.0 * Math.sqrt(2 * Math.log(1.25 / 1e-5)) / 0.5;
    assertThat(budget.noiseStdDev()).isCloseTo(expected, within(1e-12));
  }

  @Test
  void zeroSensitivity_isAllowed() {
    assertThat(new PrivacyBudget(1.0, 0.0, 0.01).noiseStdDev()).isZero();
  }

  @Test
  void invalidValues_rejected() {
    assertThatThrownBy(() -> new PrivacyBudget(-1, 1, 0.1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new PrivacyBudget(Double.NaN, 1, 0.1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new PrivacyBudget(1, Double.NaN, 0.1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new PrivacyBudget(1, 1, -0.1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new PrivacyBudget(1, 1, 1.0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void quantizationBits_fromBits() {
    assertThat(QuantizationBits.fromBits(8)).isEqualTo(QuantizationBits.EIGHT);
    assertThat(QuantizationBits.fromBits(16).maxRepresentable()).isEqualTo(32767);
    assertThatThrownBy(() -> QuantizationBits.fromBits(32))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Valid values: 8, 16");
  }
}
