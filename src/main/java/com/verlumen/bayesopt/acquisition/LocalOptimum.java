package com.verlumen.bayesopt.acquisition;

import com.google.auto.value.AutoValue;
import com.verlumen.bayesopt.space.CandidatePoint;

/** End point of one local search run of the acquisition maximizer. */
@AutoValue
public abstract class LocalOptimum {
  public static LocalOptimum create(CandidatePoint point, double value, int steps) {
    return new AutoValue_LocalOptimum(point, value, steps);
  }

  public abstract CandidatePoint point();

  /** Acquisition utility at {@link #point()}. */
  public abstract double value();

  /**
   * Gradient evaluations taken by the local optimizer. Runs that stop after one or two steps
   * suggest a flat or noisy acquisition surface.
   */
  public abstract int steps();
}
