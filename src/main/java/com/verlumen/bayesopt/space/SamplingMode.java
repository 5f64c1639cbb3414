package com.verlumen.bayesopt.space;

/** Whether a sampler must deliver the full requested count. */
public enum SamplingMode {
  /** Fail with {@link InsufficientUniqueSamplesException} if the count cannot be reached. */
  STRICT,
  /** Return as many distinct points as could be found. */
  BEST_EFFORT
}
