package com.codeheadsystems.secagg.model.round;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.secagg.masking.PairwiseMasking;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PublicKeyAnnouncementTest {

  private static final String PEER_ID = "peer-id-value";
  private static final byte[] KEY = {0x02, 0x01, 0x7f, (byte) 0xff};
  private static final String KEY_BASE64 = "AgF//w==";

  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
  }

  @Test
  void from_encodesKeyAsBase64() {
    PublicKeyAnnouncement announcement = PublicKeyAnnouncement.from(PEER_ID, KEY);

    assertThat(announcement.peerId()).isEqualTo(PEER_ID);
    assertThat(announcement.publicKeyBase64()).isEqualTo(KEY_BASE64);
    assertThat(announcement.toPublicKey()).isEqualTo(KEY);
  }

  @Test
  void json_serialization_usesCorrectPropertyNames() throws Exception {
    String json = objectMapper.writeValueAsString(new PublicKeyAnnouncement(PEER_ID, KEY_BASE64));

    assertThat(json).isEqualTo("{\"peerId\":\"" + PEER_ID + "\",\"publicKey\":\"" + KEY_BASE64 + "\"}");
  }

  @Test
  void json_deserialization_mapsToCorrectFields() throws Exception {
    String json = "{\"peerId\":\"" + PEER_ID + "\",\"publicKey\":\"" + KEY_BASE64 + "\"}";

    PublicKeyAnnouncement announcement = objectMapper.readValue(json, PublicKeyAnnouncement.class);

    assertThat(announcement.peerId()).isEqualTo(PEER_ID);
    assertThat(announcement.toPublicKey()).isEqualTo(KEY);
  }

  @Test
  void realKey_survivesTransportAndAgrees() throws Exception {
    PairwiseMasking alice = new PairwiseMasking();
    PairwiseMasking bob = new PairwiseMasking();
    String aliceJson = objectMapper.writeValueAsString(PublicKeyAnnouncement.from("alice", alice.generateKeyPair()));
    byte[] bobPk = bob.generateKeyPair();

    byte[] alicePk = objectMapper.readValue(aliceJson, PublicKeyAnnouncement.class).toPublicKey();

    assertThat(bob.deriveSharedSecret(alicePk)).isEqualTo(alice.deriveSharedSecret(bobPk));
  }

  @Test
  void toPublicKey_rejectsMissingOrInvalidFields() {
    assertThatThrownBy(() -> new PublicKeyAnnouncement(PEER_ID, null).toPublicKey())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Missing required field: publicKey");
    assertThatThrownBy(() -> new PublicKeyAnnouncement(PEER_ID, "not base64!").toPublicKey())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid base64 in field: publicKey");
    assertThatThrownBy(() -> new PublicKeyAnnouncement(null, KEY_BASE64).toPublicKey())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Missing required field: peerId");
  }
}
