package com.verlumen.bayesopt.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** Value returned by a scoring function: the score to maximize plus optional named extras. */
@AutoValue
public abstract class ScoreResult {
  public static ScoreResult of(double score) {
    return create(score, ImmutableMap.of());
  }

  public static ScoreResult create(double score, Map<String, Double> extras) {
    checkArgument(Double.isFinite(score), "Score must be finite: %s", score);
    return new AutoValue_ScoreResult(score, ImmutableMap.copyOf(extras));
  }

  public abstract double score();

  public abstract ImmutableMap<String, Double> extras();
}
