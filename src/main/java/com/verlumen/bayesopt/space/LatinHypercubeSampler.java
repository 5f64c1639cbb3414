package com.verlumen.bayesopt.space;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;

/**
 * Latin hypercube sampler. Each round stratifies every dimension into as many equal slices as
 * points still missing, places one point per slice, and maps the result back to raw units.
 * Integer rounding can collapse points together, so rounds repeat until the requested number of
 * distinct vectors exists or {@link #MAX_ATTEMPTS} rounds have run.
 */
final class LatinHypercubeSampler implements SpaceFillingSampler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RandomGenerator random;

  @Inject
  LatinHypercubeSampler(RandomGenerator random) {
    this.random = random;
  }

  @Override
  public ImmutableList<ImmutableList<Double>> sample(
      BoundsTable bounds, int count, Set<ImmutableList<Double>> exclude, SamplingMode mode) {
    checkArgument(count >= 0, "Requested sample count must be non-negative: %s", count);
    Set<ImmutableList<Double>> found = new LinkedHashSet<>();
    int attempt = 0;
    while (found.size() < count && attempt < MAX_ATTEMPTS) {
      attempt++;
      for (double[] scaled : latinCube(count - found.size(), bounds.dimension())) {
        ImmutableList<Double> raw = bounds.unscaleToList(scaled);
        if (!exclude.contains(raw)) {
          found.add(raw);
        }
      }
    }

    if (found.size() < count) {
      if (mode == SamplingMode.STRICT) {
        throw new InsufficientUniqueSamplesException(count, found.size(), attempt);
      }
      logger.atFine().log(
          "Returning %d of %d requested points after %d attempts", found.size(), count, attempt);
    }
    return ImmutableList.copyOf(found);
  }

  /** One point per stratum in every dimension, jittered uniformly inside its stratum. */
  private double[][] latinCube(int n, int dimension) {
    double[][] cube = new double[n][dimension];
    int[] strata = new int[n];
    for (int j = 0; j < dimension; j++) {
      for (int i = 0; i < n; i++) {
        strata[i] = i;
      }
      MathArrays.shuffle(strata, random);
      for (int i = 0; i < n; i++) {
        cube[i][j] = (strata[i] + random.nextDouble()) / n;
      }
    }
    return cube;
  }
}
