package com.verlumen.bayesopt.evaluation;

import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import java.util.List;

/** Scores candidates one after another on the calling thread. */
final class SequentialDispatcher implements Dispatcher {
  @Override
  public ImmutableList<EvaluationResult> evaluate(
      ScoringFunction function, BoundsTable bounds, List<CandidatePoint> batch) {
    ImmutableList.Builder<EvaluationResult> results = ImmutableList.builder();
    for (CandidatePoint candidate : batch) {
      results.add(CandidateEvaluator.evaluate(function, bounds, candidate));
    }
    return results.build();
  }

  @Override
  public int workers() {
    return 1;
  }

  @Override
  public void close() {}
}
