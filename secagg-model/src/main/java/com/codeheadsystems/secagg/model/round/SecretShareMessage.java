package com.codeheadsystems.secagg.model.round;

import com.codeheadsystems.secagg.model.WireFields;
import com.codeheadsystems.secagg.sharing.SecretShare;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One Shamir share of a participant's self-mask seed, as handed to a peer and later forwarded to
 * the aggregator when the owner's seed must be rebuilt.
 *
 * @param ownerId the participant whose seed was split
 * @param x       evaluation point, 1-based
 * @param y       share value in [0, 2^31 - 1)
 */
public record SecretShareMessage(@JsonProperty("ownerId") String ownerId,
                                 @JsonProperty("x") int x,
                                 @JsonProperty("y") long y) {

  public static SecretShareMessage from(String ownerId, SecretShare share) {
    return new SecretShareMessage(ownerId, share.x(), share.y());
  }

  /**
   * @return the core share
   * @throws IllegalArgumentException if the owner is missing or x/y are out of range
   */
  public SecretShare toSecretShare() {
    WireFields.require(ownerId, "ownerId");
    return new SecretShare(x, y);
  }
}
