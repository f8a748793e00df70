package com.codeheadsystems.secagg.masking;

import com.codeheadsystems.secagg.common.ByteUtils;
import com.codeheadsystems.secagg.config.SecAggConfig;
import com.codeheadsystems.secagg.weights.WeightExtractor;
import com.codeheadsystems.secagg.weights.WeightMap;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairwise masking for secure aggregation.
 * <p>
 * Per round, each party {@link #generateKeyPair() generates} a P-256 key pair and publishes the
 * public key. Given a peer's public key it {@link #deriveSharedSecret(byte[]) derives} the ECDH
 * secret, {@link #createMask(byte[], int) expands} it into a float mask with HKDF-SHA256, and
 * {@link #maskUpdate adds} or {@link #unmask removes} masks tensor by tensor.
 * <p>
 * The key pair is the only state and is replaced, never mutated, so concurrent derivations
 * against one instance are safe.
 */
public class PairwiseMasking {

  /**
   * Most bytes derived in one expansion: 8160 bits. Longer masks tile these words.
   */
  public static final int MAX_DERIVED_BYTES = 1020;

  /**
   * Float words available before tiling starts.
   */
  public static final int MAX_DERIVED_WORDS = MAX_DERIVED_BYTES / Float.BYTES;

  private static final Logger log = LoggerFactory.getLogger(PairwiseMasking.class);
  private static final double WORD_RANGE = 1 << 24;

  private final SecAggConfig config;
  private final Curve curve;
  private volatile RoundKeyPair keyPair;

  public PairwiseMasking() {
    this(SecAggConfig.defaults());
  }

  public PairwiseMasking(SecAggConfig config) {
    this.config = config;
    this.curve = Curve.P256_CURVE;
  }

  protected SecAggConfig config() {
    return config;
  }

  // ─── Key agreement ─────────────────────────────────────────────────────────

  /**
   * Generates a fresh key pair for this round, replacing any previous one.
   *
   * @return the compressed SEC1 public key to publish
   */
  public byte[] generateKeyPair() {
    RoundKeyPair generated = RoundKeyPair.generate(curve, config.randomProvider());
    keyPair = generated;
    log.debug("generateKeyPair(publicKey={})", generated.publicKeyHex());
    return generated.publicKey();
  }

  /**
   * The current public key.
   *
   * @return the compressed SEC1 public key
   * @throws IllegalStateException before {@link #generateKeyPair()}
   */
  public byte[] publicKey() {
    return requireKeyPair().publicKey();
  }

  /**
   * ECDH with a peer: the x-coordinate of {@code privateKey * peerPublicKey}, 32 bytes.
   * Both parties of a pair obtain byte-identical results.
   *
   * @param peerPublicKey the peer's SEC1 public key
   * @return the shared secret
   * @throws IllegalStateException before {@link #generateKeyPair()}
   * @throws SecurityException     if the peer key is not a valid curve point
   */
  public byte[] deriveSharedSecret(byte[] peerPublicKey) {
    RoundKeyPair current = requireKeyPair();
    ECPoint peer = curve.deserializePoint(peerPublicKey);
    ECPoint shared = peer.multiply(current.privateKey()).normalize();
    return ByteUtils.toFixedLength(shared.getAffineXCoord().toBigInteger(), curve.fieldSize());
  }

  private RoundKeyPair requireKeyPair() {
    RoundKeyPair current = keyPair;
    if (current == null) {
      throw new IllegalStateException("Call generateKeyPair() first.");
    }
    return current;
  }

  // ─── Mask expansion ────────────────────────────────────────────────────────

  /**
   * Expands a secret into {@code length} mask values in [-1, 1).
   * <p>
   * HKDF-SHA256 (configured salt and info) yields {@code min(4 * length, 1020)} bytes. Each
   * little-endian 32-bit word keeps its top 24 bits as a float in [-1, 1). When more than 255
   * values are requested the derived words repeat: {@code mask[i] = words[i % 255]}.
   *
   * @param secret the seed material
   * @param length number of values
   * @return the mask
   */
  public float[] createMask(byte[] secret, int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Mask length must be non-negative, got " + length);
    }
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("Mask secret must not be empty");
    }
    float[] mask = new float[length];
    if (length == 0) {
      return mask;
    }
    int byteCount = Math.min(length * Float.BYTES, MAX_DERIVED_BYTES);
    byte[] okm = hkdf(secret, byteCount);
    float[] source = new float[byteCount / Float.BYTES];
    for (int w = 0; w < source.length; w++) {
      long word = ByteUtils.readUint32LE(okm, w * Float.BYTES);
      source[w] = (float) ((word >>> 8) / WORD_RANGE * 2.0 - 1.0);
    }
    for (int i = 0; i < length; i++) {
      mask[i] = source[i % source.length];
    }
    return mask;
  }

  private byte[] hkdf(byte[] secret, int length) {
    HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
    generator.init(new HKDFParameters(secret, config.maskSalt(), config.maskInfo()));
    byte[] out = new byte[length];
    generator.generateBytes(out, 0, length);
    return out;
  }

  // ─── Apply / remove ────────────────────────────────────────────────────────

  /**
   * {@code masked = delta + mask} for every tensor that has a mask; others are copied unchanged.
   *
   * @param delta          the update to mask
   * @param masksByTensor  masks keyed by tensor name
   * @return the masked update
   * @throws com.codeheadsystems.secagg.exceptions.DimensionMismatchException if a mask length differs from its tensor
   */
  public WeightMap maskUpdate(WeightMap delta, WeightMap masksByTensor) {
    return WeightExtractor.addScaled(delta, masksByTensor, 1f);
  }

  /**
   * {@code unmasked = maskedSum - mask} for every tensor that has a mask. Exact inverse of
   * {@link #maskUpdate} up to float rounding.
   *
   * @param maskedSum     a masked update or a sum of them
   * @param masksToRemove masks keyed by tensor name
   * @return the unmasked values
   */
  public WeightMap unmask(WeightMap maskedSum, WeightMap masksToRemove) {
    return WeightExtractor.addScaled(maskedSum, masksToRemove, -1f);
  }
}
