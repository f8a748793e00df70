package com.codeheadsystems.secagg.training;

/**
 * Local training parameters.
 *
 * @param modelId      model being trained, for logs
 * @param epochs       number of step calls, at least 1
 * @param batchSize    passed through to the step
 * @param learningRate passed through to the step
 */
public record TrainingConfig(String modelId, int epochs, int batchSize, double learningRate) {

  public TrainingConfig {
    if (epochs < 1) {
      throw new IllegalArgumentException("epochs must be at least 1, got " + epochs);
    }
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
    }
    if (modelId == null) {
      modelId = "unknown";
    }
  }
}
