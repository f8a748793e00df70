package com.codeheadsystems.secagg.config;

import com.codeheadsystems.secagg.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * Configuration for pairwise masking and secret sharing.
 * Holds the HKDF domain-separation label and salt used for mask expansion, and the random source
 * for key generation and Shamir coefficients.
 *
 * @param maskInfo       HKDF info string, fixed for every mask derived under this configuration
 * @param maskSalt       HKDF salt
 * @param randomProvider the random source
 */
public record SecAggConfig(byte[] maskInfo, byte[] maskSalt, RandomProvider randomProvider) {

  /**
   * HKDF-SHA256 output length; also the salt length.
   */
  public static final int Nh = 32;

  /**
   * The default domain-separation label for pairwise masks.
   */
  public static final String DEFAULT_MASK_INFO = "secagg-pairwise-mask";


  public SecAggConfig {
    Objects.requireNonNull(maskInfo, "maskInfo");
    Objects.requireNonNull(maskSalt, "maskSalt");
    Objects.requireNonNull(randomProvider, "randomProvider");
    maskInfo = maskInfo.clone();
    maskSalt = maskSalt.clone();
  }

  /**
   * Default configuration: {@value #DEFAULT_MASK_INFO} label, all-zero salt, and a
   * {@link RandomProvider} of its own. Each call returns a new random source.
   *
   * @return the sec agg config
   */
  public static SecAggConfig defaults() {
    return new SecAggConfig(DEFAULT_MASK_INFO.getBytes(StandardCharsets.UTF_8), new byte[Nh],
        new RandomProvider());
  }

  /**
   * Default labels with the given random source, for deterministic tests.
   *
   * @param random the random
   * @return the sec agg config
   */
  public static SecAggConfig forTesting(SecureRandom random) {
    return new SecAggConfig(DEFAULT_MASK_INFO.getBytes(StandardCharsets.UTF_8), new byte[Nh],
        new RandomProvider(random));
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   *
   * @param randomProvider the random provider
   * @return the sec agg config
   */
  public SecAggConfig withRandomProvider(RandomProvider randomProvider) {
    return new SecAggConfig(maskInfo, maskSalt, randomProvider);
  }

  /**
   * Returns a new config with a different mask label.
   *
   * @param maskInfo the mask info
   * @return the sec agg config
   */
  public SecAggConfig withMaskInfo(String maskInfo) {
    return new SecAggConfig(maskInfo.getBytes(StandardCharsets.UTF_8), maskSalt, randomProvider);
  }

  @Override
  public byte[] maskInfo() {
    return maskInfo.clone();
  }

  @Override
  public byte[] maskSalt() {
    return maskSalt.clone();
  }
}
