package com.verlumen.bayesopt.evaluation;

import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import java.io.Closeable;
import java.util.List;

/** Runs the scoring function over a batch of candidates. */
public interface Dispatcher extends Closeable {
  /**
   * Scores every candidate of the batch. Results are returned in batch order, whatever order the
   * evaluations completed in.
   *
   * @throws EvaluationException on the first failing candidate; no partial results are returned
   */
  ImmutableList<EvaluationResult> evaluate(
      ScoringFunction function, BoundsTable bounds, List<CandidatePoint> batch);

  /** Number of candidates that can be scored at the same time. */
  int workers();

  @Override
  void close();
}
