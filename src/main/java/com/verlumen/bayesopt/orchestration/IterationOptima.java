package com.verlumen.bayesopt.orchestration;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.acquisition.AcquisitionFunction;
import com.verlumen.bayesopt.acquisition.LocalOptimum;
import com.verlumen.bayesopt.space.CandidatePoint;

/** Record of the acquisition search of one iteration. */
@AutoValue
public abstract class IterationOptima {
  static IterationOptima create(
      int iteration,
      AcquisitionFunction acquisition,
      ImmutableList<LocalOptimum> localOptima,
      ImmutableList<LocalOptimum> seeds,
      ImmutableList<CandidatePoint> candidates) {
    return new AutoValue_IterationOptima(iteration, acquisition, localOptima, seeds, candidates);
  }

  public abstract int iteration();

  /** Function maximized in this iteration, after any impatience switch. */
  public abstract AcquisitionFunction acquisition();

  /** Every local optimum the multi-start search found. */
  public abstract ImmutableList<LocalOptimum> localOptima();

  /** Distinct optima that survived retention and seeded the batch. */
  public abstract ImmutableList<LocalOptimum> seeds();

  /** Candidates handed to the scoring function. */
  public abstract ImmutableList<CandidatePoint> candidates();
}
