package com.codeheadsystems.secagg.masking;

import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Domain parameters of the key-agreement curve.
 *
 * @param params the domain parameters
 * @param g      the generator
 * @param n      the group order
 * @param h      the cofactor
 */
public record Curve(ECDomainParameters params, ECPoint g, BigInteger n, BigInteger h) {

  public static final Curve P256_CURVE = loadCurve("P-256");

  public Curve(ECDomainParameters params) {
    this(params, params.getG(), params.getN(), params.getH());
  }

  private static Curve loadCurve(String name) {
    X9ECParameters params = CustomNamedCurves.getByName(name);
    if (params == null) {
      throw new IllegalArgumentException("Unsupported curve: " + name);
    }
    return new Curve(new ECDomainParameters(
        params.getCurve(),
        params.getG(),
        params.getN(),
        params.getH()
    ));
  }

  /**
   * Field element size in bytes (32 for P-256).
   *
   * @return the int
   */
  public int fieldSize() {
    return (params.getCurve().getFieldSize() + 7) / 8;
  }

  /**
   * Compressed SEC1 size: prefix byte plus one field element.
   *
   * @return the int
   */
  public int elementSize() {
    return 1 + fieldSize();
  }

  /**
   * Deserializes a SEC1 byte array to a point, rejecting the identity and off-curve points.
   *
   * @param bytes compressed or uncompressed SEC1 encoding
   * @return the point
   * @throws SecurityException if the point is invalid
   */
  public ECPoint deserializePoint(byte[] bytes) {
    ECPoint p;
    try {
      p = params.getCurve().decodePoint(bytes);
    } catch (IllegalArgumentException e) {
      throw new SecurityException("Invalid EC point encoding", e);
    }
    if (p.isInfinity()) {
      throw new SecurityException("Invalid EC point: identity element not allowed");
    }
    if (!p.isValid()) {
      throw new SecurityException("Invalid EC point: not on curve");
    }
    if (!h.equals(BigInteger.ONE) && !p.multiply(n).isInfinity()) {
      throw new SecurityException("Invalid EC point: not in prime-order subgroup");
    }
    return p;
  }
}
