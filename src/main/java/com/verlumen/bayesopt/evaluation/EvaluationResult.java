package com.verlumen.bayesopt.evaluation;

import com.google.auto.value.AutoValue;
import com.verlumen.bayesopt.space.CandidatePoint;

/** A candidate together with what the scoring function returned for it and how long it took. */
@AutoValue
public abstract class EvaluationResult {
  public static EvaluationResult create(
      CandidatePoint candidate, ScoreResult result, double elapsedSeconds) {
    return new AutoValue_EvaluationResult(candidate, result, elapsedSeconds);
  }

  public abstract CandidatePoint candidate();

  public abstract ScoreResult result();

  public abstract double elapsedSeconds();
}
