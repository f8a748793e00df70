package com.codeheadsystems.secagg.training;

import com.codeheadsystems.secagg.weights.WeightDelta;
import com.codeheadsystems.secagg.weights.WeightMap;
import java.time.Duration;

/**
 * Outcome of {@link LocalTrainer#train}.
 *
 * @param finalWeights weights after the last epoch
 * @param delta        finalWeights - initialWeights
 * @param deltaNorm    L2 norm of the delta
 * @param duration     wall-clock time spent training
 */
public record TrainingResult(WeightMap finalWeights, WeightDelta delta, double deltaNorm,
                             Duration duration) {
}
