package com.verlumen.bayesopt.observations;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** One scored parameter vector. */
@AutoValue
public abstract class Observation {
  public static Observation create(
      int iteration,
      ImmutableList<Double> parameters,
      double elapsedSeconds,
      double score,
      ImmutableMap<String, Double> extras) {
    checkArgument(iteration >= 0, "Iteration must be non-negative: %s", iteration);
    checkArgument(!parameters.isEmpty(), "Parameter vector cannot be empty");
    // -0.0 and 0.0 must identify the same parameter vector.
    ImmutableList<Double> normalized =
        parameters.stream().map(value -> value + 0.0).collect(ImmutableList.toImmutableList());
    return new AutoValue_Observation(iteration, normalized, elapsedSeconds, score, extras);
  }

  /** Round that produced this observation; 0 for the initial design. */
  public abstract int iteration();

  /** Raw parameter values in the order of the bounds table. */
  public abstract ImmutableList<Double> parameters();

  public abstract double elapsedSeconds();

  public abstract double score();

  /** Additional named values returned by the scoring function. */
  public abstract ImmutableMap<String, Double> extras();

  public Observation withIteration(int newIteration) {
    return create(newIteration, parameters(), elapsedSeconds(), score(), extras());
  }
}
