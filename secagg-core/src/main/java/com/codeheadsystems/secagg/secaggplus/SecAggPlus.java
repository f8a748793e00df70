package com.codeheadsystems.secagg.secaggplus;

import com.codeheadsystems.secagg.common.ByteUtils;
import com.codeheadsystems.secagg.config.SecAggConfig;
import com.codeheadsystems.secagg.exceptions.InsufficientSharesException;
import com.codeheadsystems.secagg.masking.PairwiseMasking;
import com.codeheadsystems.secagg.sharing.ModularArithmetic;
import com.codeheadsystems.secagg.sharing.SecretShare;
import com.codeheadsystems.secagg.sharing.ShamirSecretSharing;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairwise masking plus dropout recovery: a mask seed is split with a fixed threshold T so that
 * any T surviving peers can rebuild it.
 */
public class SecAggPlus extends PairwiseMasking {

  private static final Logger log = LoggerFactory.getLogger(SecAggPlus.class);

  private final int threshold;
  private final ShamirSecretSharing sharing;

  public SecAggPlus(int threshold) {
    this(threshold, SecAggConfig.defaults());
  }

  /**
   * Instantiates a new SecAggPlus.
   *
   * @param threshold minimum number of shares for a reconstruction, at least 1
   * @param config    the config
   */
  public SecAggPlus(int threshold, SecAggConfig config) {
    super(config);
    if (threshold < 1) {
      throw new IllegalArgumentException("Threshold must be at least 1, got " + threshold);
    }
    this.threshold = threshold;
    this.sharing = new ShamirSecretSharing(config.randomProvider());
  }

  public int threshold() {
    return threshold;
  }

  /**
   * Splits a secret into one share per peer.
   *
   * @param secret   the secret
   * @param numPeers number of shares, at least the threshold
   * @return the shares
   */
  public List<SecretShare> splitSecret(long secret, int numPeers) {
    return sharing.split(secret, threshold, numPeers);
  }

  /**
   * Rebuilds a secret from the first T of the given shares.
   *
   * @param shares at least T shares of one split
   * @return the secret
   * @throws InsufficientSharesException if fewer than T shares are given
   */
  public long reconstructSecret(List<SecretShare> shares) {
    if (shares.size() < threshold) {
      throw new InsufficientSharesException(threshold, shares.size());
    }
    log.debug("reconstructSecret(provided={}, threshold={})", shares.size(), threshold);
    return sharing.reconstruct(shares.subList(0, threshold));
  }

  /**
   * A uniformly random field element to use as a self-mask seed.
   *
   * @return the seed
   */
  public long newMaskSeed() {
    return config().randomProvider().nextInt((int) ModularArithmetic.PRIME);
  }

  /**
   * Expands a field-element seed into a mask. The seed is encoded as 4 big-endian bytes, so a
   * seed rebuilt by {@link #reconstructSecret} yields the identical mask.
   *
   * @param seed   value in [0, p)
   * @param length number of values
   * @return the mask
   */
  public float[] createSeedMask(long seed, int length) {
    if (seed < 0 || seed >= ModularArithmetic.PRIME) {
      throw new IllegalArgumentException("Seed out of field range: " + seed);
    }
    return createMask(ByteUtils.I2OSP((int) seed, 4), length);
  }
}
