package com.verlumen.bayesopt.cluster;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.acquisition.LocalOptimum;
import com.verlumen.bayesopt.space.CandidatePoint;

/** Candidates chosen for the next round and the local optima that seeded them. */
@AutoValue
public abstract class CandidateBatch {
  public static CandidateBatch create(
      ImmutableList<LocalOptimum> seeds, ImmutableList<CandidatePoint> candidates) {
    return new AutoValue_CandidateBatch(seeds, candidates);
  }

  /** Retained, de-duplicated local optima, best utility first. */
  public abstract ImmutableList<LocalOptimum> seeds();

  public abstract ImmutableList<CandidatePoint> candidates();
}
