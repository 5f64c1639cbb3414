package com.verlumen.bayesopt.orchestration;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.verlumen.bayesopt.observations.Observation;
import com.verlumen.bayesopt.observations.ObservationSchema;
import com.verlumen.bayesopt.surrogate.SurrogateHandle;
import java.util.Optional;

/** Outcome of a completed run. */
@AutoValue
public abstract class OptimizationResult {
  static Builder builder() {
    return new AutoValue_OptimizationResult.Builder();
  }

  /** Score surrogate as of the last acquisition search; it has not seen the final batch. */
  public abstract SurrogateHandle scoreSurrogate();

  /** Elapsed-time surrogate, present only while EIPS was still in use at the end of the run. */
  public abstract Optional<SurrogateHandle> elapsedSurrogate();

  public abstract ImmutableList<IterationOptima> history();

  public abstract ObservationSchema schema();

  /** Every observation, initial design and resumed rows included, in the order they were added. */
  public abstract ImmutableList<Observation> observations();

  /** One entry per iteration, iteration 0 being the initial design. */
  public abstract ImmutableList<BestSnapshot> bestSnapshots();

  public abstract int checkpointSaves();

  public Observation best() {
    return Iterables.getLast(bestSnapshots()).best();
  }

  /** Best parameter set keyed by parameter name. */
  public ImmutableMap<String, Double> bestParameters() {
    ImmutableMap.Builder<String, Double> parameters = ImmutableMap.builder();
    ImmutableList<String> names = schema().parameterNames();
    for (int i = 0; i < names.size(); i++) {
      parameters.put(names.get(i), best().parameters().get(i));
    }
    return parameters.build();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setScoreSurrogate(SurrogateHandle value);

    abstract Builder setElapsedSurrogate(Optional<SurrogateHandle> value);

    abstract Builder setHistory(ImmutableList<IterationOptima> value);

    abstract Builder setSchema(ObservationSchema value);

    abstract Builder setObservations(ImmutableList<Observation> value);

    abstract Builder setBestSnapshots(ImmutableList<BestSnapshot> value);

    abstract Builder setCheckpointSaves(int value);

    abstract OptimizationResult build();
  }
}
