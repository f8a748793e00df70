package com.codeheadsystems.secagg.privacy;

import com.codeheadsystems.secagg.common.RandomProvider;
import com.codeheadsystems.secagg.weights.WeightDelta;
import com.codeheadsystems.secagg.weights.WeightExtractor;
import com.codeheadsystems.secagg.weights.WeightMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Differential privacy (gradient clipping and Gaussian noise) and symmetric quantization for
 * weight deltas. All transforms return fresh maps except {@link #clip} when no clipping is needed.
 * <p>
 * Noise is drawn from this filter's {@link RandomProvider}; with the default provider results are
 * not reproducible. Inject a seeded provider to make them so.
 */
public class PrivacyFilter {

  private static final Logger log = LoggerFactory.getLogger(PrivacyFilter.class);

  private final RandomProvider randomProvider;

  public PrivacyFilter() {
    this(new RandomProvider());
  }

  public PrivacyFilter(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  // ─── Clipping ──────────────────────────────────────────────────────────────

  /**
   * Scales the delta down so its L2 norm is at most {@code maxNorm}. When the norm is already
   * within bounds the same instance is returned. An empty delta is always returned as is.
   *
   * @param delta   the delta
   * @param maxNorm the maximum L2 norm, non-negative
   * @return the clipped delta, or {@code delta} itself
   * @throws IllegalArgumentException if {@code maxNorm} is negative or NaN
   */
  public WeightDelta clip(WeightDelta delta, double maxNorm) {
    if (delta.isEmpty()) {
      return delta;
    }
    if (!(maxNorm >= 0)) {
      throw new IllegalArgumentException("maxNorm must be non-negative, got " + maxNorm);
    }
    double norm = WeightExtractor.l2Norm(delta);
    if (norm <= maxNorm) {
      return delta;
    }
    double scale = maxNorm / norm;
    log.debug("clip(norm={}, maxNorm={})", norm, maxNorm);
    WeightMap.Builder builder = WeightMap.builder();
    delta.forEach((name, values) -> {
      for (int i = 0; i < values.length; i++) {
        values[i] = (float) (values[i] * scale);
      }
      builder.put(name, values);
    });
    return builder.buildDelta();
  }

  // ─── Gaussian noise ────────────────────────────────────────────────────────

  /**
   * Adds one independent N(0, sigma^2) sample to every element.
   *
   * @param delta       the delta
   * @param epsilon     privacy loss, strictly positive
   * @param sensitivity L2 sensitivity, non-negative
   * @param deltaDP     failure probability, in (0, 1)
   * @return the noisy delta
   */
  public WeightDelta addGaussianNoise(WeightDelta delta, double epsilon, double sensitivity,
                                      double deltaDP) {
    return addGaussianNoise(delta, new PrivacyBudget(epsilon, sensitivity, deltaDP));
  }

  /**
   * Adds one independent N(0, sigma^2) sample to every element, sigma taken from the budget.
   *
   * @param delta  the delta
   * @param budget the budget
   * @return the noisy delta
   */
  public WeightDelta addGaussianNoise(WeightDelta delta, PrivacyBudget budget) {
    double sigma = budget.noiseStdDev();
    log.debug("addGaussianNoise(epsilon={}, deltaDP={}, sigma={})", budget.epsilon(), budget.deltaDP(), sigma);
    WeightMap.Builder builder = WeightMap.builder();
    delta.forEach((name, values) -> {
      for (int i = 0; i < values.length; i++) {
        values[i] = (float) (values[i] + gaussian() * sigma);
      }
      builder.put(name, values);
    });
    return builder.buildDelta();
  }

  /**
   * Box-Muller transform over two uniform draws, rejecting a zero first draw.
   */
  double gaussian() {
    double u1;
    double u2;
    do {
      u1 = randomProvider.nextDouble();
      u2 = randomProvider.nextDouble();
    } while (u1 == 0);
    return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
  }

  // ─── Quantization ──────────────────────────────────────────────────────────

  /**
   * Per-tensor symmetric min-max quantization.
   *
   * @param delta the delta
   * @param bits  8 or 16
   * @return the quantized weight map
   * @throws IllegalArgumentException for any other width
   */
  public QuantizedWeightMap quantize(WeightMap delta, int bits) {
    return quantize(delta, QuantizationBits.fromBits(bits));
  }

  /**
   * Per-tensor symmetric min-max quantization: {@code scale = max|x| / maxRepresentable},
   * {@code q = round(x / scale)}, zero point 0. An all-zero tensor gets scale 1.
   *
   * @param delta the delta
   * @param bits  the width
   * @return the quantized weight map
   */
  public QuantizedWeightMap quantize(WeightMap delta, QuantizationBits bits) {
    int maxVal = bits.maxRepresentable();
    Map<String, QuantizedTensor> result = new LinkedHashMap<>();
    delta.forEach((name, values) -> {
      double absMax = 0;
      for (float v : values) {
        absMax = Math.max(absMax, Math.abs(v));
      }
      double scale = absMax > 0 ? absMax / maxVal : 1;
      short[] quantized = new short[values.length];
      for (int i = 0; i < values.length; i++) {
        long q = Math.round(values[i] / scale);
        quantized[i] = (short) Math.max(-maxVal, Math.min(maxVal, q));
      }
      result.put(name, new QuantizedTensor(quantized, scale, 0, bits));
    });
    log.debug("quantize(tensors={}, bits={})", result.size(), bits.bits());
    return new QuantizedWeightMap(result);
  }

  /**
   * Restores floats: {@code (q - zeroPoint) * scale}.
   *
   * @param quantized the quantized
   * @return the weight map
   */
  public WeightMap dequantize(QuantizedWeightMap quantized) {
    WeightMap.Builder builder = WeightMap.builder();
    quantized.tensors().forEach((name, tensor) -> {
      float[] values = new float[tensor.length()];
      for (int i = 0; i < values.length; i++) {
        values[i] = (float) ((tensor.get(i) - tensor.zeroPoint()) * tensor.scale());
      }
      builder.put(name, values);
    });
    return builder.build();
  }
}
