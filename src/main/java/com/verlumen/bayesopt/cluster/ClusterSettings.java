package com.verlumen.bayesopt.cluster;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Controls how local optima are turned into a batch of candidates. */
@AutoValue
public abstract class ClusterSettings {
  public static final double DEFAULT_NOISE_ADD = 0.25;

  public static ClusterSettings create(Optional<Double> minClusterUtility, double noiseAdd) {
    minClusterUtility.ifPresent(
        fraction ->
            checkArgument(
                fraction >= 0.0 && fraction <= 1.0,
                "minClusterUtility must be within [0, 1]: %s",
                fraction));
    checkArgument(noiseAdd > 0.0 && noiseAdd <= 1.0, "noiseAdd must be in (0, 1]: %s", noiseAdd);
    return new AutoValue_ClusterSettings(minClusterUtility, noiseAdd);
  }

  /**
   * Fraction of the best utility a weaker local optimum needs to seed candidates of its own. When
   * empty only the global optimum seeds the batch.
   */
  public abstract Optional<Double> minClusterUtility();

  /** Half-width of the noise neighbourhood around a seed, as a fraction of each range. */
  public abstract double noiseAdd();
}
