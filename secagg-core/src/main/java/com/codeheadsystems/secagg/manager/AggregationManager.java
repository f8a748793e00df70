package com.codeheadsystems.secagg.manager;

import com.codeheadsystems.secagg.config.RoundPolicy;
import com.codeheadsystems.secagg.config.SecAggConfig;
import com.codeheadsystems.secagg.secaggplus.MaskSchedule;
import com.codeheadsystems.secagg.secaggplus.SecAggPlus;
import com.codeheadsystems.secagg.sharing.SecretShare;
import com.codeheadsystems.secagg.weights.WeightExtractor;
import com.codeheadsystems.secagg.weights.WeightMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server side of a round: sums masked updates and strips the masks that do not cancel.
 * <p>
 * Pairwise masks between submitters cancel in the sum. What remains is each submitter's self
 * mask, recovered from Shamir shares of its seed, and the half-pairs that submitters shared with
 * peers that dropped before submitting, reported by the survivors as corrections.
 */
@Singleton
public class AggregationManager {
  static private final Logger log = LoggerFactory.getLogger(AggregationManager.class);

  private final Supplier<RoundPolicy> roundPolicySupplier;
  private final SecAggConfig config;

  @Inject
  public AggregationManager(final Supplier<RoundPolicy> roundPolicySupplier,
                            final SecAggConfig config) {
    this.roundPolicySupplier = roundPolicySupplier;
    this.config = config;
    log.info("AggregationManager({})", roundPolicySupplier);
  }

  /**
   * Unmasked sum of the submitted updates.
   *
   * @param maskedUpdates        masked update per submitter id
   * @param seedSharesBySubmitter shares of each submitter's self-mask seed, at least T each
   * @param dropoutCorrections   corrections from survivors for peers that never submitted
   * @return the aggregate
   * @throws com.codeheadsystems.secagg.exceptions.InsufficientSharesException if a submitter has fewer than T shares
   * @throws IllegalArgumentException if a submitter has no shares at all
   */
  public WeightMap aggregate(Map<String, WeightMap> maskedUpdates,
                             Map<String, List<SecretShare>> seedSharesBySubmitter,
                             List<WeightMap> dropoutCorrections) {
    if (maskedUpdates.isEmpty()) {
      throw new IllegalArgumentException("No masked updates to aggregate");
    }
    RoundPolicy policy = roundPolicySupplier.get();
    SecAggPlus secAggPlus = new SecAggPlus(policy.threshold(), config);

    WeightMap sum = WeightExtractor.sum(List.copyOf(maskedUpdates.values()));
    for (String submitter : maskedUpdates.keySet()) {
      List<SecretShare> shares = seedSharesBySubmitter.get(submitter);
      if (shares == null) {
        throw new IllegalArgumentException("No seed shares for submitter " + submitter);
      }
      long seed = secAggPlus.reconstructSecret(shares);
      sum = secAggPlus.unmask(sum, MaskSchedule.selfMask(secAggPlus, seed, sum));
    }
    for (WeightMap correction : dropoutCorrections) {
      sum = secAggPlus.unmask(sum, correction);
    }
    log.info("aggregate(submitters={}, corrections={}, threshold={})",
        maskedUpdates.size(), dropoutCorrections.size(), policy.threshold());
    return sum;
  }
}
