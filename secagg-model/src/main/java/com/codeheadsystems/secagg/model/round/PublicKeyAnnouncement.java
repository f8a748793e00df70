package com.codeheadsystems.secagg.model.round;

import com.codeheadsystems.secagg.model.WireFields;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model a participant publishes at the start of a round so that every peer can derive the
 * pairwise secret with it.
 * <p>
 * The public key is the compressed SEC1 P-256 point from
 * {@link com.codeheadsystems.secagg.masking.PairwiseMasking#generateKeyPair()}, base64-encoded
 * because it is a raw byte array.
 *
 * @param peerId          identifier of the announcing participant; also orders the mask signs
 * @param publicKeyBase64 base64-encoded compressed public key
 */
public record PublicKeyAnnouncement(@JsonProperty("peerId") String peerId,
                                    @JsonProperty("publicKey") String publicKeyBase64) {

  /**
   * Builds an announcement from raw key bytes.
   *
   * @param peerId    the peer id
   * @param publicKey the public key
   * @return the public key announcement
   */
  public static PublicKeyAnnouncement from(String peerId, byte[] publicKey) {
    return new PublicKeyAnnouncement(peerId, WireFields.encodeBase64(publicKey));
  }

  /**
   * Decoded key bytes, ready for
   * {@link com.codeheadsystems.secagg.masking.PairwiseMasking#deriveSharedSecret(byte[])}.
   *
   * @return the bytes
   * @throws IllegalArgumentException if the peer id or key is missing or the key is not base64
   */
  public byte[] toPublicKey() {
    WireFields.require(peerId, "peerId");
    return WireFields.decodeBase64(publicKeyBase64, "publicKey");
  }
}
