package com.verlumen.bayesopt.orchestration;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.evaluation.ScoringFunction;
import com.verlumen.bayesopt.observations.ObservationLog;
import com.verlumen.bayesopt.space.BoundsTable;
import java.util.Optional;

/** Everything a run needs: what to score, where, from which starting data, and how. */
@AutoValue
public abstract class OptimizationRequest {
  public abstract ScoringFunction scoringFunction();

  public abstract BoundsTable bounds();

  /** Caller-chosen initial design in raw units; empty to draw one by latin hypercube. */
  public abstract ImmutableList<ImmutableList<Double>> initialGrid();

  /** Observations of an earlier run, typically read back from its checkpoint. */
  public abstract Optional<ObservationLog> resumedLog();

  public abstract OptimizationConfig config();

  public static Builder builder() {
    return new AutoValue_OptimizationRequest.Builder().setInitialGrid(ImmutableList.of());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setScoringFunction(ScoringFunction value);

    public abstract Builder setBounds(BoundsTable value);

    public abstract Builder setInitialGrid(ImmutableList<ImmutableList<Double>> value);

    public abstract Builder setResumedLog(ObservationLog value);

    public abstract Builder setConfig(OptimizationConfig value);

    public abstract OptimizationRequest build();
  }
}
