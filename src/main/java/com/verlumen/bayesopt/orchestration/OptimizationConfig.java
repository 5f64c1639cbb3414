package com.verlumen.bayesopt.orchestration;

import com.google.auto.value.AutoValue;
import com.verlumen.bayesopt.acquisition.AcquisitionParams;
import com.verlumen.bayesopt.acquisition.ImpatienceRule;
import com.verlumen.bayesopt.cluster.ClusterSettings;
import com.verlumen.bayesopt.surrogate.Kernel;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Settings of one optimization run. Defaults: initialize, no initial points, one candidate per
 * round, Matern52 kernel with beta 0, UCB with kappa 2.576, eps 0, 100 local search starts,
 * convergence factor 1e7, only the global optimum seeds each batch, noise half-width 0.25,
 * progress logging, no checkpoint file, sequential evaluation.
 */
@AutoValue
public abstract class OptimizationConfig {
  public static final int DEFAULT_GS_POINTS = 100;
  public static final double DEFAULT_CONV_THRESH = 1e7;

  /** Whether to score an initial design before the first surrogate fit. */
  public abstract boolean initialize();

  /** Size of the latin hypercube initial design; 0 when an initial grid is supplied. */
  public abstract int initPoints();

  /** Candidates scored per round. */
  public abstract int bulkNew();

  /** Total number of distinct parameter sets to score, initial design included. */
  public abstract int nIters();

  public abstract Kernel kernel();

  /** Acquisition function name: ucb, ei, eips or poi. */
  public abstract String acquisition();

  public abstract ImpatienceRule impatience();

  public abstract double kappa();

  public abstract double eps();

  /** Starting points of the multi-start acquisition search. */
  public abstract int gsPoints();

  /** Local optimizer tolerance in multiples of machine epsilon. */
  public abstract double convThresh();

  public abstract Optional<Double> minClusterUtility();

  public abstract double noiseAdd();

  public abstract Verbosity verbosity();

  /** File the observation log is written to after every batch. */
  public abstract Optional<Path> checkpointPath();

  public abstract boolean parallel();

  /** Size of the available worker pool. */
  public abstract int parallelism();

  public AcquisitionParams acquisitionParams() {
    return AcquisitionParams.create(kappa(), eps());
  }

  public ClusterSettings clusterSettings() {
    return ClusterSettings.create(minClusterUtility(), noiseAdd());
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_OptimizationConfig.Builder()
        .setInitialize(true)
        .setInitPoints(0)
        .setBulkNew(1)
        .setNIters(0)
        .setKernel(Kernel.matern52())
        .setAcquisition("ucb")
        .setImpatience(ImpatienceRule.never())
        .setKappa(AcquisitionParams.DEFAULT_KAPPA)
        .setEps(AcquisitionParams.DEFAULT_EPS)
        .setGsPoints(DEFAULT_GS_POINTS)
        .setConvThresh(DEFAULT_CONV_THRESH)
        .setNoiseAdd(ClusterSettings.DEFAULT_NOISE_ADD)
        .setVerbosity(Verbosity.PROGRESS)
        .setParallel(false)
        .setParallelism(1);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setInitialize(boolean value);

    public abstract Builder setInitPoints(int value);

    public abstract Builder setBulkNew(int value);

    public abstract Builder setNIters(int value);

    public abstract Builder setKernel(Kernel value);

    public abstract Builder setAcquisition(String value);

    public abstract Builder setImpatience(ImpatienceRule value);

    public abstract Builder setKappa(double value);

    public abstract Builder setEps(double value);

    public abstract Builder setGsPoints(int value);

    public abstract Builder setConvThresh(double value);

    public abstract Builder setMinClusterUtility(double value);

    public abstract Builder setNoiseAdd(double value);

    public abstract Builder setVerbosity(Verbosity value);

    public abstract Builder setCheckpointPath(Path value);

    public abstract Builder setParallel(boolean value);

    public abstract Builder setParallelism(int value);

    abstract OptimizationConfig autoBuild();

    public OptimizationConfig build() {
      OptimizationConfig config = autoBuild();
      require(config.initPoints() >= 0, "initPoints must be non-negative");
      require(config.bulkNew() > 0, "bulkNew must be positive");
      require(config.nIters() >= 0, "nIters must be non-negative");
      require(config.gsPoints() > 0, "gsPoints must be positive");
      require(config.convThresh() > 0, "convThresh must be positive");
      require(config.parallelism() > 0, "parallelism must be positive");
      require(
          Double.isFinite(config.kappa()) && Double.isFinite(config.eps()),
          "kappa and eps must be finite");
      require(
          config.noiseAdd() > 0 && config.noiseAdd() <= 1, "noiseAdd must be within (0, 1]");
      config
          .minClusterUtility()
          .ifPresent(
              fraction ->
                  require(
                      fraction >= 0 && fraction <= 1, "minClusterUtility must be within [0, 1]"));
      return config;
    }

    private static void require(boolean condition, String message) {
      if (!condition) {
        throw new ConfigurationException(message);
      }
    }
  }
}
