package com.codeheadsystems.secagg.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.codeheadsystems.secagg.config.RoundPolicy;
import com.codeheadsystems.secagg.config.SecAggConfig;
import com.codeheadsystems.secagg.exceptions.InsufficientSharesException;
import com.codeheadsystems.secagg.manager.AggregationManager;
import com.codeheadsystems.secagg.model.round.PublicKeyAnnouncement;
import com.codeheadsystems.secagg.model.round.RoundPolicyResponse;
import com.codeheadsystems.secagg.model.round.SecretShareMessage;
import com.codeheadsystems.secagg.model.update.QuantizedUpdateSubmission;
import com.codeheadsystems.secagg.model.update.WeightUpdateSubmission;
import com.codeheadsystems.secagg.privacy.PrivacyBudget;
import com.codeheadsystems.secagg.privacy.PrivacyFilter;
import com.codeheadsystems.secagg.privacy.QuantizedWeightMap;
import com.codeheadsystems.secagg.sharing.SecretShare;
import com.codeheadsystems.secagg.training.TrainingConfig;
import com.codeheadsystems.secagg.weights.WeightExtractor;
import com.codeheadsystems.secagg.weights.WeightMap;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Base end-to-end round: every message between clients and the aggregator goes through its JSON
 * wire record, and the unmasked aggregate must equal the sum of the survivors' privatized deltas.
 */
abstract class AbstractSecureRoundTest {

  private static final WeightMap GLOBAL_WEIGHTS = WeightMap.builder()
      .put("dense.kernel", new float[300])
      .put("dense.bias", new float[]{0.1f, -0.1f, 0.2f, -0.2f})
      .build();
  private static final TrainingConfig TRAINING = new TrainingConfig("integration-model", 2, 16, 0.25);

  private ObjectMapper objectMapper;
  private RoundPolicy policy;
  private List<RoundParticipant> participants;

  protected abstract int clientCount();

  protected abstract int threshold();

  protected abstract int droppedCount();

  @BeforeEach
  void setUp() throws Exception {
    objectMapper = new ObjectMapper();
    RoundPolicy serverPolicy = new RoundPolicy(new PrivacyBudget(2.0, 1.0, 1e-5), 1.0,
        RoundPolicy.DEFAULT.quantizationBits(), threshold());
    String policyJson = objectMapper.writeValueAsString(RoundPolicyResponse.from(serverPolicy));
    policy = objectMapper.readValue(policyJson, RoundPolicyResponse.class).toRoundPolicy();

    participants = new ArrayList<>();
    for (int i = 0; i < clientCount(); i++) {
      participants.add(new RoundParticipant(String.format("device-%02d", i), policy));
    }
    exchangeKeys();
    exchangeSeedShares();
    for (int i = 0; i < participants.size(); i++) {
      participants.get(i).train(GLOBAL_WEIGHTS, TRAINING, 0.5f * (i + 1));
    }
  }

  private <T> T transport(Object message, Class<T> type) throws Exception {
    return objectMapper.readValue(objectMapper.writeValueAsString(message), type);
  }

  private void exchangeKeys() throws Exception {
    List<PublicKeyAnnouncement> announcements = new ArrayList<>();
    for (RoundParticipant participant : participants) {
      announcements.add(transport(participant.announce(), PublicKeyAnnouncement.class));
    }
    for (RoundParticipant participant : participants) {
      announcements.forEach(participant::receive);
    }
  }

  private void exchangeSeedShares() throws Exception {
    List<String> order = participants.stream().map(RoundParticipant::id).toList();
    for (RoundParticipant owner : participants) {
      Map<String, SecretShareMessage> byHolder = owner.shareSeed(order);
      for (RoundParticipant holder : participants) {
        holder.hold(transport(byHolder.get(holder.id()), SecretShareMessage.class));
      }
    }
  }

  private List<RoundParticipant> survivors() {
    return participants.subList(0, clientCount() - droppedCount());
  }

  private List<RoundParticipant> dropped() {
    return participants.subList(clientCount() - droppedCount(), clientCount());
  }

  private WeightMap runAggregation(List<RoundParticipant> submitters) throws Exception {
    Map<String, WeightMap> masked = new LinkedHashMap<>();
    for (RoundParticipant submitter : submitters) {
      WeightUpdateSubmission submission = transport(
          WeightUpdateSubmission.from(submitter.id(), submitter.maskedUpdate()), WeightUpdateSubmission.class);
      masked.put(submission.deviceId(), submission.toWeightMap());
    }

    List<WeightMap> corrections = new ArrayList<>();
    for (RoundParticipant submitter : submitters) {
      for (RoundParticipant gone : participants) {
        if (!submitters.contains(gone)) {
          corrections.add(transport(
              WeightUpdateSubmission.from(submitter.id(), submitter.dropoutCorrection(gone.id())),
              WeightUpdateSubmission.class).toWeightMap());
        }
      }
    }

    Map<String, List<SecretShare>> seedShares = new LinkedHashMap<>();
    for (RoundParticipant owner : submitters) {
      List<SecretShare> shares = new ArrayList<>();
      for (RoundParticipant holder : submitters) {
        shares.add(transport(holder.heldShareOf(owner.id()), SecretShareMessage.class).toSecretShare());
      }
      seedShares.put(owner.id(), shares);
    }

    AggregationManager aggregationManager = new AggregationManager(() -> policy, SecAggConfig.defaults());
    return aggregationManager.aggregate(masked, seedShares, corrections);
  }

  private static void assertClose(WeightMap actual, WeightMap expected) {
    assertThat(actual.names()).containsExactlyElementsOf(expected.names());
    for (String name : expected.names()) {
      float[] e = expected.tensor(name);
      float[] a = actual.tensor(name);
      for (int i = 0; i < e.length; i++) {
        assertThat(a[i]).as("%s[%d]", name, i).isCloseTo(e[i], within(1e-3f));
      }
    }
  }

  @Test
  void roundWithDropouts_aggregateEqualsSumOfSurvivorDeltas() throws Exception {
    WeightMap aggregate = runAggregation(survivors());

    WeightMap expected = WeightExtractor.sum(survivors().stream().map(RoundParticipant::privatized).toList());
    assertClose(aggregate, expected);
  }

  @Test
  void everyoneSubmits_aggregateEqualsSumOfAllDeltas() throws Exception {
    WeightMap aggregate = runAggregation(participants);

    WeightMap expected = WeightExtractor.sum(participants.stream().map(RoundParticipant::privatized).toList());
    assertClose(aggregate, expected);
  }

  @Test
  void maskedSubmissionDoesNotRevealDelta() {
    RoundParticipant first = participants.get(0);

    WeightMap masked = first.maskedUpdate();

    double distance = WeightExtractor.l2Norm(WeightExtractor.computeDelta(first.privatized(), masked));
    assertThat(distance).isGreaterThan(1.0);
  }

  @Test
  void aggregateExcludesDroppedClients() throws Exception {
    WeightMap aggregate = runAggregation(survivors());

    WeightMap withDropped = WeightExtractor.sum(participants.stream().map(RoundParticipant::privatized).toList());
    WeightMap droppedSum = WeightExtractor.sum(dropped().stream().map(RoundParticipant::privatized).toList());
    assertThat(WeightExtractor.l2Norm(WeightExtractor.computeDelta(withDropped, aggregate)))
        .isCloseTo(WeightExtractor.l2Norm(droppedSum), within(1e-2));
  }

  @Test
  void tooFewSurvivors_cannotRebuildSeeds() {
    List<RoundParticipant> tooFew = participants.subList(0, threshold() - 1);

    assertThatThrownBy(() -> runAggregation(tooFew)).isInstanceOf(InsufficientSharesException.class);
  }

  @Test
  void compressedUpdate_survivesTransport() throws Exception {
    RoundParticipant participant = participants.get(0);
    QuantizedWeightMap compressed = participant.clientUpdateManager().compress(participant.privatized());

    QuantizedWeightMap received = transport(
        QuantizedUpdateSubmission.from(participant.id(), compressed), QuantizedUpdateSubmission.class)
        .toQuantizedWeightMap();
    WeightMap restored = new PrivacyFilter().dequantize(received);

    for (String name : GLOBAL_WEIGHTS.names()) {
      float[] original = participant.privatized().tensor(name);
      float[] values = restored.tensor(name);
      double halfStep = received.tensor(name).scale() / 2 + 1e-5;
      for (int i = 0; i < original.length; i++) {
        assertThat((double) values[i]).isCloseTo(original[i], within(halfStep));
      }
    }
  }
}
