package com.verlumen.bayesopt.orchestration;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.bayesopt.acquisition.AcquisitionModule;
import com.verlumen.bayesopt.checkpoint.CheckpointModule;
import com.verlumen.bayesopt.cluster.ClusterModule;
import com.verlumen.bayesopt.evaluation.EvaluationModule;
import com.verlumen.bayesopt.space.SpaceModule;
import com.verlumen.bayesopt.surrogate.SurrogateModule;
import java.util.Optional;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/** Wires the whole optimizer. A fixed seed makes sampling and noise reproducible. */
@AutoValue
public abstract class OptimizationModule extends AbstractModule {
  public static OptimizationModule create() {
    return new AutoValue_OptimizationModule(Optional.empty());
  }

  public static OptimizationModule create(long seed) {
    return new AutoValue_OptimizationModule(Optional.of(seed));
  }

  abstract Optional<Long> seed();

  @Override
  protected void configure() {
    install(SpaceModule.create());
    install(SurrogateModule.create());
    install(AcquisitionModule.create());
    install(ClusterModule.create());
    install(EvaluationModule.create());
    install(CheckpointModule.create());
    bind(OptimizationOrchestrator.class).to(OptimizationOrchestratorImpl.class);
  }

  @Provides
  @Singleton
  RandomGenerator provideRandomGenerator() {
    return seed().map(Well19937c::new).orElseGet(Well19937c::new);
  }
}
