package com.verlumen.bayesopt.evaluation;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import java.util.concurrent.TimeUnit;

/** Scores one candidate and times the call. */
final class CandidateEvaluator {
  private CandidateEvaluator() {}

  static EvaluationResult evaluate(
      ScoringFunction function, BoundsTable bounds, CandidatePoint candidate) {
    ImmutableMap<String, Double> parameters = bounds.toNamedValues(candidate.raw());
    Stopwatch stopwatch = Stopwatch.createStarted();
    ScoreResult result;
    try {
      result = function.score(parameters);
    } catch (Exception e) {
      throw new EvaluationException(parameters, e);
    }
    if (result == null) {
      throw new EvaluationException(
          parameters, new NullPointerException("Scoring function must return a Score"));
    }
    double elapsedSeconds = stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9;
    return EvaluationResult.create(candidate, result, elapsedSeconds);
  }
}
