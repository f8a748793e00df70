package com.codeheadsystems.secagg.manager;

import com.codeheadsystems.secagg.config.RoundPolicy;
import com.codeheadsystems.secagg.masking.PairwiseMasking;
import com.codeheadsystems.secagg.privacy.PrivacyFilter;
import com.codeheadsystems.secagg.privacy.QuantizedWeightMap;
import com.codeheadsystems.secagg.weights.WeightDelta;
import com.codeheadsystems.secagg.weights.WeightExtractor;
import com.codeheadsystems.secagg.weights.WeightMap;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of a round: turns two weight snapshots into a privatized delta, then masks or
 * compresses it under the current {@link RoundPolicy}.
 */
@Singleton
public class ClientUpdateManager {
  static private final Logger log = LoggerFactory.getLogger(ClientUpdateManager.class);

  private final Supplier<RoundPolicy> roundPolicySupplier;
  private final PrivacyFilter privacyFilter;
  private final PairwiseMasking pairwiseMasking;

  @Inject
  public ClientUpdateManager(final Supplier<RoundPolicy> roundPolicySupplier,
                             final PrivacyFilter privacyFilter,
                             final PairwiseMasking pairwiseMasking) {
    this.roundPolicySupplier = roundPolicySupplier;
    this.privacyFilter = privacyFilter;
    this.pairwiseMasking = pairwiseMasking;
    log.info("ClientUpdateManager({})", roundPolicySupplier);
  }

  /**
   * {@code computeDelta -> clip -> addGaussianNoise}, with the policy read once per call.
   *
   * @param before weights before local training
   * @param after  weights after local training
   * @return the privatized delta
   */
  public WeightDelta privatize(WeightMap before, WeightMap after) {
    RoundPolicy policy = roundPolicySupplier.get();
    WeightDelta delta = WeightExtractor.computeDelta(before, after);
    WeightDelta clipped = privacyFilter.clip(delta, policy.clipNorm());
    log.info("privatize(tensors={}, clipped={}, epsilon={})",
        delta.size(), clipped != delta, policy.budget().epsilon());
    return privacyFilter.addGaussianNoise(clipped, policy.budget());
  }

  /**
   * Adds this client's masks to a privatized delta.
   *
   * @param delta the delta
   * @param masks masks keyed by tensor name
   * @return the masked update to submit
   */
  public WeightMap mask(WeightDelta delta, WeightMap masks) {
    return pairwiseMasking.maskUpdate(delta, masks);
  }

  /**
   * Quantizes a delta to the policy's width.
   *
   * @param delta the delta
   * @return the quantized weight map
   */
  public QuantizedWeightMap compress(WeightDelta delta) {
    RoundPolicy policy = roundPolicySupplier.get();
    return privacyFilter.quantize(delta, policy.quantizationBits());
  }
}
