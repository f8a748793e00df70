package com.codeheadsystems.secagg.sharing;

/**
 * Arithmetic in GF(p) for p = 2^31 - 1. Operands are field elements in [0, p); every product is
 * formed in a {@code long}, which holds any product of two such elements without overflow.
 */
public class ModularArithmetic {

  /**
   * The Mersenne prime 2^31 - 1.
   */
  public static final long PRIME = 2147483647L;

  private ModularArithmetic() {
  }

  /**
   * Maps any long into [0, p).
   *
   * @param value the value
   * @return the field element
   */
  public static long normalize(long value) {
    return Math.floorMod(value, PRIME);
  }

  public static long add(long a, long b) {
    return (a + b) % PRIME;
  }

  /**
   * {@code (a - b) mod p}, always in [0, p).
   *
   * @param a the a
   * @param b the b
   * @return the long
   */
  public static long sub(long a, long b) {
    return (a - b + PRIME) % PRIME;
  }

  public static long mul(long a, long b) {
    return (a * b) % PRIME;
  }

  /**
   * Square-and-multiply exponentiation.
   *
   * @param base     the base
   * @param exponent non-negative exponent
   * @return base^exponent mod p
   */
  public static long pow(long base, long exponent) {
    if (exponent < 0) {
      throw new IllegalArgumentException("Exponent must be non-negative");
    }
    long result = 1;
    long b = normalize(base);
    long e = exponent;
    while (e > 0) {
      if ((e & 1) == 1) {
        result = mul(result, b);
      }
      b = mul(b, b);
      e >>= 1;
    }
    return result;
  }

  /**
   * Multiplicative inverse by Fermat's little theorem: a^(p-2).
   *
   * @param a non-zero field element
   * @return the inverse
   * @throws ArithmeticException if {@code a} is zero mod p
   */
  public static long inverse(long a) {
    long n = normalize(a);
    if (n == 0) {
      throw new ArithmeticException("Zero has no inverse mod " + PRIME);
    }
    return pow(n, PRIME - 2);
  }
}
