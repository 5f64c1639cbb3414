package com.verlumen.bayesopt.orchestration;

import com.google.auto.value.AutoValue;
import com.verlumen.bayesopt.observations.Observation;

/** The best observation known after an iteration, and when it was known. */
@AutoValue
public abstract class BestSnapshot {
  static BestSnapshot create(int iteration, Observation best, long elapsedSeconds) {
    return new AutoValue_BestSnapshot(iteration, best, elapsedSeconds);
  }

  public abstract int iteration();

  public abstract Observation best();

  /** Whole seconds since the run started. */
  public abstract long elapsedSeconds();
}
