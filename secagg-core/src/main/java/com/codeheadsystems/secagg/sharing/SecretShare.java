package com.codeheadsystems.secagg.sharing;

/**
 * One Shamir share: the polynomial evaluated at {@code x}.
 *
 * @param x evaluation point, 1-based
 * @param y value in [0, p)
 */
public record SecretShare(int x, long y) {

  public SecretShare {
    if (x < 1) {
      throw new IllegalArgumentException("Share index must be at least 1, got " + x);
    }
    if (y < 0 || y >= ModularArithmetic.PRIME) {
      throw new IllegalArgumentException("Share value out of field range: " + y);
    }
  }
}
