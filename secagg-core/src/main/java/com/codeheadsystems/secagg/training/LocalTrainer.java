package com.codeheadsystems.secagg.training;

import com.codeheadsystems.secagg.weights.WeightDelta;
import com.codeheadsystems.secagg.weights.WeightExtractor;
import com.codeheadsystems.secagg.weights.WeightMap;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs caller-supplied training steps and produces the delta that enters the privacy pipeline.
 */
public class LocalTrainer {

  private static final Logger log = LoggerFactory.getLogger(LocalTrainer.class);

  private final Clock clock;

  public LocalTrainer() {
    this(Clock.systemUTC());
  }

  public LocalTrainer(Clock clock) {
    this.clock = clock;
  }

  /**
   * Calls {@code step} once per epoch starting from {@code initialWeights}, which are never
   * mutated, and returns the final weights together with their delta.
   *
   * @param initialWeights the starting weights
   * @param config         the config
   * @param step           the training step
   * @return the training result
   * @throws IllegalStateException if a step fails or returns null
   */
  public TrainingResult train(WeightMap initialWeights, TrainingConfig config, TrainStep step) {
    Instant start = clock.instant();
    WeightMap weights = initialWeights;
    for (int epoch = 0; epoch < config.epochs(); epoch++) {
      TrainStep.StepContext context =
          new TrainStep.StepContext(epoch, config.batchSize(), config.learningRate());
      try {
        weights = step.step(weights, context);
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new IllegalStateException("Training step failed at epoch " + epoch, e);
      }
      if (weights == null) {
        throw new IllegalStateException("Training step returned no weights at epoch " + epoch);
      }
    }
    WeightDelta delta = WeightExtractor.computeDelta(initialWeights, weights);
    double norm = WeightExtractor.l2Norm(delta);
    Duration duration = Duration.between(start, clock.instant());
    log.info("train(model={}, epochs={}, deltaNorm={}, durationMs={})",
        config.modelId(), config.epochs(), norm, duration.toMillis());
    return new TrainingResult(weights, delta, norm, duration);
  }
}
