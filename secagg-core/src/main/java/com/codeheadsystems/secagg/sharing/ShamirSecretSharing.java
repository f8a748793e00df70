package com.codeheadsystems.secagg.sharing;

import static com.codeheadsystems.secagg.sharing.ModularArithmetic.PRIME;

import com.codeheadsystems.secagg.common.RandomProvider;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shamir's (T, N) threshold scheme over GF(2^31 - 1).
 * <p>
 * {@link #split} hides the secret in the constant term of a random polynomial of degree T-1 and
 * hands out its values at x = 1..N. Any T of them give the secret back through
 * {@link #reconstruct}; fewer reveal nothing about it.
 */
public class ShamirSecretSharing {

  private final RandomProvider randomProvider;

  public ShamirSecretSharing() {
    this(new RandomProvider());
  }

  public ShamirSecretSharing(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Splits {@code secret mod p} into {@code numShares} shares, any {@code threshold} of which
   * reconstruct it. With threshold 1 every share equals the secret.
   *
   * @param secret    the secret; reduced mod p
   * @param threshold T, in [1, numShares]
   * @param numShares N
   * @return N shares with x = 1..N
   * @throws IllegalArgumentException if the threshold is out of range
   */
  public List<SecretShare> split(long secret, int threshold, int numShares) {
    if (threshold < 1 || threshold > numShares) {
      throw new IllegalArgumentException("Threshold must be in [1, " + numShares + "], got " + threshold);
    }
    if (numShares >= PRIME) {
      throw new IllegalArgumentException("Too many shares for the field: " + numShares);
    }
    long[] coefficients = new long[threshold];
    coefficients[0] = ModularArithmetic.normalize(secret);
    for (int i = 1; i < threshold; i++) {
      // PRIME == Integer.MAX_VALUE, so nextInt draws uniformly from [0, p).
      coefficients[i] = randomProvider.nextInt((int) PRIME);
    }
    List<SecretShare> shares = new ArrayList<>(numShares);
    for (int x = 1; x <= numShares; x++) {
      shares.add(new SecretShare(x, evaluate(coefficients, x)));
    }
    return shares;
  }

  /**
   * Horner evaluation of the polynomial at x.
   */
  static long evaluate(long[] coefficients, long x) {
    long y = 0;
    for (int i = coefficients.length - 1; i >= 0; i--) {
      y = ModularArithmetic.add(ModularArithmetic.mul(y, x), coefficients[i]);
    }
    return y;
  }

  /**
   * Lagrange interpolation at x = 0. Every share supplied takes part; callers pass at least T
   * shares from one split.
   *
   * @param shares the shares
   * @return the secret, in [0, p)
   * @throws IllegalArgumentException if no shares are given or two shares have the same index
   */
  public long reconstruct(List<SecretShare> shares) {
    if (shares == null || shares.isEmpty()) {
      throw new IllegalArgumentException("At least one share is required");
    }
    Set<Integer> seen = new HashSet<>();
    for (SecretShare share : shares) {
      if (!seen.add(share.x())) {
        throw new IllegalArgumentException("Duplicate share index: " + share.x());
      }
    }
    long secret = 0;
    int n = shares.size();
    for (int i = 0; i < n; i++) {
      long xi = shares.get(i).x();
      long num = 1;
      long den = 1;
      for (int j = 0; j < n; j++) {
        if (i == j) {
          continue;
        }
        long xj = shares.get(j).x();
        num = ModularArithmetic.mul(num, ModularArithmetic.sub(0, xj));
        den = ModularArithmetic.mul(den, ModularArithmetic.sub(xi, xj));
      }
      long lagrange = ModularArithmetic.mul(num, ModularArithmetic.inverse(den));
      secret = ModularArithmetic.add(secret, ModularArithmetic.mul(shares.get(i).y(), lagrange));
    }
    return secret;
  }
}
