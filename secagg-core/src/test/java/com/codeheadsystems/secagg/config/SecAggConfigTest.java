package com.codeheadsystems.secagg.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.secagg.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class SecAggConfigTest {

  @Test
  void default_usesLabelAndZeroSalt() {
    assertThat(new String(SecAggConfig.defaults().maskInfo(), StandardCharsets.UTF_8))
        .isEqualTo(SecAggConfig.DEFAULT_MASK_INFO);
    assertThat(SecAggConfig.defaults().maskSalt()).hasSize(SecAggConfig.Nh).containsOnly(0);
  }

  @Test
  void accessorsReturnCopies() {
    SecAggConfig config = SecAggConfig.defaults();
    config.maskSalt()[0] = 9;
    config.maskInfo()[0] = 9;

    assertThat(config.maskSalt()[0]).isZero();
    assertThat(config.maskInfo()[0]).isEqualTo((byte) 's');
  }

  @Test
  void defaults_eachCallHasItsOwnRandom() {
    SecAggConfig first = SecAggConfig.defaults();
    SecAggConfig second = SecAggConfig.defaults();

    assertThat(first.randomProvider()).isNotSameAs(second.randomProvider());
    assertThat(first.randomProvider().random()).isNotSameAs(second.randomProvider().random());
  }

  @Test
  void withers_keepOtherFields() {
    SecureRandom random = new SecureRandom();
    SecAggConfig testing = SecAggConfig.forTesting(random);
    SecAggConfig relabeled = testing.withMaskInfo("other");

    assertThat(testing.randomProvider().random()).isSameAs(random);
    assertThat(testing.maskInfo()).isEqualTo(SecAggConfig.defaults().maskInfo());
    assertThat(relabeled.randomProvider().random()).isSameAs(random);
    assertThat(relabeled.maskInfo()).isEqualTo("other".getBytes(StandardCharsets.UTF_8));
    assertThat(relabeled.withRandomProvider(new RandomProvider()).maskSalt()).isEqualTo(testing.maskSalt());
  }
}
