package com.verlumen.bayesopt.cluster;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.bayesopt.acquisition.LocalOptimum;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import com.verlumen.bayesopt.space.SamplingMode;
import com.verlumen.bayesopt.space.SpaceFillingSampler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Keeps the global acquisition optimum (and, when configured, every optimum within a fraction of
 * it), drops near-duplicates, and fills the rest of the batch with shape (4,4) Beta noise around
 * the kept optima.
 *
 * <p>Extra candidates go first one per kept optimum in order of utility; once every optimum has
 * one, the remainder is split in proportion to utility by largest remainder.
 */
final class CandidateClustererImpl implements CandidateClusterer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Optima closer than this in the unit hypercube are treated as the same point. */
  @VisibleForTesting static final double DUPLICATE_TOLERANCE = 1e-2;

  private static final double NOISE_SHAPE = 4.0;
  private static final int MAX_NOISE_ATTEMPTS = 100;

  private final SpaceFillingSampler sampler;
  private final BetaDistribution noise;

  @Inject
  CandidateClustererImpl(SpaceFillingSampler sampler, RandomGenerator random) {
    this.sampler = sampler;
    this.noise = new BetaDistribution(random, NOISE_SHAPE, NOISE_SHAPE);
  }

  @Override
  public CandidateBatch select(
      BoundsTable bounds,
      List<LocalOptimum> optima,
      int batchSize,
      ClusterSettings settings,
      Set<ImmutableList<Double>> evaluated) {
    checkArgument(!optima.isEmpty(), "At least one local optimum is required");
    checkArgument(batchSize > 0, "Batch size must be positive: %s", batchSize);

    ImmutableList<LocalOptimum> seeds =
        deduplicate(retain(optima, settings.minClusterUtility()));
    Set<ImmutableList<Double>> taken = new HashSet<>(evaluated);
    List<CandidatePoint> batch = new ArrayList<>(batchSize);
    for (LocalOptimum seed : seeds) {
      if (batch.size() == batchSize) {
        break;
      }
      if (taken.add(seed.point().raw())) {
        batch.add(seed.point());
      }
    }

    int[] allocation = allocate(seeds, batchSize - batch.size());
    int shortfall = 0;
    for (int i = 0; i < seeds.size(); i++) {
      for (int j = 0; j < allocation[i]; j++) {
        Optional<CandidatePoint> extra =
            drawAround(bounds, seeds.get(i).point(), settings.noiseAdd(), taken);
        if (extra.isPresent()) {
          batch.add(extra.get());
        } else {
          shortfall++;
        }
      }
    }

    if (shortfall > 0) {
      logger.atWarning().log(
          "Could not find %d new candidates near the acquisition optima; sampling them from the"
              + " whole space instead.",
          shortfall);
      for (ImmutableList<Double> raw :
          sampler.sample(bounds, shortfall, taken, SamplingMode.STRICT)) {
        taken.add(raw);
        batch.add(CandidatePoint.fromRaw(bounds, raw));
      }
    }
    return CandidateBatch.create(seeds, ImmutableList.copyOf(batch));
  }

  /** Optima worth seeding candidates, best first. */
  @VisibleForTesting
  static ImmutableList<LocalOptimum> retain(
      List<LocalOptimum> optima, Optional<Double> minClusterUtility) {
    ImmutableList<LocalOptimum> sorted =
        ImmutableList.sortedCopyOf(
            Comparator.comparingDouble(LocalOptimum::value).reversed(), optima);
    LocalOptimum globalMax = sorted.get(0);
    if (minClusterUtility.isEmpty()) {
      return ImmutableList.of(globalMax);
    }
    // Equals threshold * max for positive utilities and stays below max for negative ones.
    double cutoff =
        globalMax.value() - (1.0 - minClusterUtility.get()) * Math.abs(globalMax.value());
    return sorted.stream()
        .filter(optimum -> optimum.value() >= cutoff)
        .collect(ImmutableList.toImmutableList());
  }

  @VisibleForTesting
  static ImmutableList<LocalOptimum> deduplicate(List<LocalOptimum> sorted) {
    List<LocalOptimum> kept = new ArrayList<>();
    for (LocalOptimum candidate : sorted) {
      boolean duplicate =
          kept.stream()
              .anyMatch(
                  other ->
                      other.point().raw().equals(candidate.point().raw())
                          || distance(other, candidate) < DUPLICATE_TOLERANCE);
      if (!duplicate) {
        kept.add(candidate);
      }
    }
    return ImmutableList.copyOf(kept);
  }

  /**
   * Number of noise candidates per seed. Seeds are sorted best first; each receives one before
   * any receives a second, the remainder following utility by largest remainder.
   */
  @VisibleForTesting
  static int[] allocate(List<LocalOptimum> seeds, int extras) {
    int[] allocation = new int[seeds.size()];
    if (extras <= 0) {
      return allocation;
    }
    if (extras <= seeds.size()) {
      for (int i = 0; i < extras; i++) {
        allocation[i] = 1;
      }
      return allocation;
    }

    int rest = extras - seeds.size();
    double min = seeds.stream().mapToDouble(LocalOptimum::value).min().getAsDouble();
    double shift = min < 0.0 ? -min : 0.0;
    double[] weights = new double[seeds.size()];
    double total = 0.0;
    for (int i = 0; i < seeds.size(); i++) {
      weights[i] = seeds.get(i).value() + shift;
      total += weights[i];
    }
    if (!(total > 0.0)) {
      Arrays.fill(weights, 1.0);
      total = seeds.size();
    }

    double[] remainders = new double[seeds.size()];
    int assigned = 0;
    for (int i = 0; i < seeds.size(); i++) {
      double quota = rest * weights[i] / total;
      int whole = (int) Math.floor(quota);
      allocation[i] = 1 + whole;
      remainders[i] = quota - whole;
      assigned += whole;
    }
    for (int left = rest - assigned; left > 0; left--) {
      int pick = 0;
      for (int i = 1; i < remainders.length; i++) {
        if (remainders[i] > remainders[pick]) {
          pick = i;
        }
      }
      allocation[pick]++;
      remainders[pick] = -1.0;
    }
    return allocation;
  }

  private Optional<CandidatePoint> drawAround(
      BoundsTable bounds,
      CandidatePoint center,
      double noiseAdd,
      Set<ImmutableList<Double>> taken) {
    double[] origin = center.scaledArray();
    for (int attempt = 0; attempt < MAX_NOISE_ATTEMPTS; attempt++) {
      double[] scaled = new double[origin.length];
      for (int i = 0; i < origin.length; i++) {
        scaled[i] = origin[i] + (2.0 * noise.sample() - 1.0) * noiseAdd;
      }
      CandidatePoint point = CandidatePoint.fromScaled(bounds, scaled);
      if (taken.add(point.raw())) {
        return Optional.of(point);
      }
    }
    return Optional.empty();
  }

  private static double distance(LocalOptimum a, LocalOptimum b) {
    double sum = 0.0;
    for (int i = 0; i < a.point().scaled().size(); i++) {
      double diff = a.point().scaled().get(i) - b.point().scaled().get(i);
      sum += diff * diff;
    }
    return Math.sqrt(sum);
  }
}
