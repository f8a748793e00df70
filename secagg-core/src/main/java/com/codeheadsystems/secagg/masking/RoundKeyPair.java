package com.codeheadsystems.secagg.masking;

import com.codeheadsystems.secagg.common.RandomProvider;
import java.math.BigInteger;
import org.bouncycastle.util.encoders.Hex;

/**
 * A P-256 key pair generated fresh for one aggregation round. Only {@link #publicKey()} is meant
 * to leave the owning party.
 *
 * @param privateKey scalar in [1, n-1]
 * @param publicKey  compressed SEC1 encoding of privateKey * G
 */
public record RoundKeyPair(BigInteger privateKey, byte[] publicKey) {

  /**
   * Generates a key pair on the given curve.
   *
   * @param curve          the curve
   * @param randomProvider the random provider
   * @return the round key pair
   */
  public static RoundKeyPair generate(Curve curve, RandomProvider randomProvider) {
    BigInteger n = curve.n();
    BigInteger k;
    do {
      k = new BigInteger(n.bitLength(), randomProvider.random());
    } while (k.signum() == 0 || k.compareTo(n) >= 0);
    byte[] pk = curve.g().multiply(k).normalize().getEncoded(true);
    return new RoundKeyPair(k, pk);
  }

  @Override
  public byte[] publicKey() {
    return publicKey.clone();
  }

  /**
   * Hex of the compressed public key, for logs and diagnostics.
   *
   * @return the string
   */
  public String publicKeyHex() {
    return Hex.toHexString(publicKey);
  }

  @Override
  public String toString() {
    return "RoundKeyPair[publicKey=" + publicKeyHex() + "]";
  }
}
