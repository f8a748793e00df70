package com.codeheadsystems.secagg.training;

import com.codeheadsystems.secagg.weights.WeightMap;

/**
 * One epoch of caller-supplied local training.
 */
@FunctionalInterface
public interface TrainStep {

  /**
   * Produces updated weights.
   *
   * @param weights current weights
   * @param context epoch index and hyper-parameters
   * @return the weights after this step
   * @throws Exception if training fails; checked exceptions are wrapped by {@link LocalTrainer}
   */
  WeightMap step(WeightMap weights, StepContext context) throws Exception;

  /**
   * Hyper-parameters handed to each step.
   *
   * @param epoch        zero-based epoch index
   * @param batchSize    the batch size
   * @param learningRate the learning rate
   */
  record StepContext(int epoch, int batchSize, double learningRate) {
  }
}
