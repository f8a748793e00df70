package com.codeheadsystems.secagg.common;

import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random generation.
 * Used for round key generation, Gaussian noise, Shamir coefficients and mask seeds.
 * Tests may pass a seeded instance; production code uses the no-arg constructor.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Uniform double in [0, 1).
   *
   * @return the double
   */
  public double nextDouble() {
    return random.nextDouble();
  }

  /**
   * Uniform int in [0, bound).
   *
   * @param bound exclusive upper bound, must be positive
   * @return the int
   */
  public int nextInt(int bound) {
    return random.nextInt(bound);
  }
}
