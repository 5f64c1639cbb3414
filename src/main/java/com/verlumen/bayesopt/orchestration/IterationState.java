package com.verlumen.bayesopt.orchestration;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.acquisition.AcquisitionFunction;
import com.verlumen.bayesopt.observations.ObservationLog;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Mutable bookkeeping of a single run. Not shared between threads. */
final class IterationState {
  private final Stopwatch clock;
  private final List<IterationOptima> history = new ArrayList<>();
  private final List<BestSnapshot> bestSnapshots = new ArrayList<>();
  private AcquisitionFunction acquisition;
  private int iteration;
  private int checkpointSaves;

  IterationState(AcquisitionFunction acquisition, Stopwatch clock) {
    this.acquisition = acquisition;
    this.clock = clock;
  }

  int iteration() {
    return iteration;
  }

  int advance() {
    return ++iteration;
  }

  AcquisitionFunction acquisition() {
    return acquisition;
  }

  void setAcquisition(AcquisitionFunction acquisition) {
    this.acquisition = acquisition;
  }

  void recordOptima(IterationOptima optima) {
    history.add(optima);
  }

  /** Returns true if the best score rose in this iteration. */
  boolean recordBest(ObservationLog log) {
    BestSnapshot snapshot =
        BestSnapshot.create(
            iteration,
            log.best().orElseThrow(() -> new IllegalStateException("No observations yet")),
            Math.round(clock.elapsed(TimeUnit.MILLISECONDS) / 1000.0));
    boolean improved =
        bestSnapshots.isEmpty()
            || snapshot.best().score() > bestSnapshots.get(bestSnapshots.size() - 1).best().score();
    bestSnapshots.add(snapshot);
    return improved;
  }

  int checkpointSaved() {
    return ++checkpointSaves;
  }

  int checkpointSaves() {
    return checkpointSaves;
  }

  ImmutableList<IterationOptima> history() {
    return ImmutableList.copyOf(history);
  }

  ImmutableList<BestSnapshot> bestSnapshots() {
    return ImmutableList.copyOf(bestSnapshots);
  }
}
