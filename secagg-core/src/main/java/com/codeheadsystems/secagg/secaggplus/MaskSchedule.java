package com.codeheadsystems.secagg.secaggplus;

import com.codeheadsystems.secagg.masking.PairwiseMasking;
import com.codeheadsystems.secagg.weights.WeightMap;
import java.util.Map;

/**
 * Sign convention that makes pairwise masks cancel in the aggregate.
 * <p>
 * For parties u and v sharing secret s, u adds PRG(s) when {@code u.compareTo(v) > 0} and
 * subtracts it otherwise; v does the opposite, so the pair contributes nothing to the sum of
 * both masked updates. Each party may also add a self mask derived from a seed it secret-shares,
 * which the server removes after reconstructing the seed.
 */
public class MaskSchedule {

  private MaskSchedule() {
  }

  /**
   * +1 when self sorts after the peer, -1 otherwise.
   *
   * @param selfId this party
   * @param peerId the peer
   * @return the sign
   */
  public static int sign(String selfId, String peerId) {
    int cmp = selfId.compareTo(peerId);
    if (cmp == 0) {
      throw new IllegalArgumentException("A party cannot mask against itself: " + selfId);
    }
    return cmp > 0 ? 1 : -1;
  }

  /**
   * Signed sum of the pairwise masks against every peer, shaped like {@code template}.
   *
   * @param masking        the masking instance used to expand secrets
   * @param selfId         this party
   * @param secretsByPeer  ECDH secret per peer id
   * @param template       gives the tensor names and lengths; values are ignored
   * @return masks keyed by tensor name
   */
  public static WeightMap pairwiseMasks(PairwiseMasking masking, String selfId,
                                        Map<String, byte[]> secretsByPeer, WeightMap template) {
    Map<String, float[]> acc = template.zerosLike().toMap();
    for (Map.Entry<String, byte[]> peer : secretsByPeer.entrySet()) {
      if (peer.getKey().equals(selfId)) {
        continue;
      }
      accumulate(acc, masking, peer.getValue(), sign(selfId, peer.getKey()));
    }
    return WeightMap.of(acc);
  }

  /**
   * Adds the self mask expanded from {@code seed} to existing masks.
   *
   * @param masks      the masks
   * @param secAggPlus expands the seed
   * @param seed       the self-mask seed
   * @return masks keyed by tensor name
   */
  public static WeightMap withSelfMask(WeightMap masks, SecAggPlus secAggPlus, long seed) {
    return WeightMap.of(accumulateSeed(masks.toMap(), secAggPlus, seed));
  }

  /**
   * The self mask alone, shaped like {@code template}.
   *
   * @param secAggPlus expands the seed
   * @param seed       the self-mask seed
   * @param template   gives the tensor names and lengths
   * @return masks keyed by tensor name
   */
  public static WeightMap selfMask(SecAggPlus secAggPlus, long seed, WeightMap template) {
    return WeightMap.of(accumulateSeed(template.zerosLike().toMap(), secAggPlus, seed));
  }

  /**
   * The signed pairwise mask a survivor added for a peer that never submitted. Subtracting it
   * from the aggregate removes the uncancelled half of the pair.
   *
   * @param masking   the survivor's masking instance
   * @param selfId    the survivor
   * @param droppedId the peer that dropped
   * @param secret    their shared secret
   * @param template  gives the tensor names and lengths
   * @return masks keyed by tensor name
   */
  public static WeightMap dropoutCorrection(PairwiseMasking masking, String selfId, String droppedId,
                                            byte[] secret, WeightMap template) {
    Map<String, float[]> acc = template.zerosLike().toMap();
    accumulate(acc, masking, secret, sign(selfId, droppedId));
    return WeightMap.of(acc);
  }

  private static void accumulate(Map<String, float[]> acc, PairwiseMasking masking, byte[] secret,
                                 int sign) {
    for (Map.Entry<String, float[]> tensor : acc.entrySet()) {
      float[] values = tensor.getValue();
      float[] mask = masking.createMask(secret, values.length);
      for (int i = 0; i < values.length; i++) {
        values[i] += sign * mask[i];
      }
    }
  }

  private static Map<String, float[]> accumulateSeed(Map<String, float[]> acc, SecAggPlus secAggPlus,
                                                     long seed) {
    for (Map.Entry<String, float[]> tensor : acc.entrySet()) {
      float[] values = tensor.getValue();
      float[] mask = secAggPlus.createSeedMask(seed, values.length);
      for (int i = 0; i < values.length; i++) {
        values[i] += mask[i];
      }
    }
    return acc;
  }
}
