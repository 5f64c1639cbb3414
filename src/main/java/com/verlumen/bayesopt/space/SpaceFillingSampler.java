package com.verlumen.bayesopt.space;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** Produces sets of distinct raw parameter vectors that cover the search space evenly. */
public interface SpaceFillingSampler {
  /** Maximum number of sampling rounds used to top up a deficit of distinct points. */
  int MAX_ATTEMPTS = 100;

  /**
   * Draws {@code count} distinct raw parameter vectors.
   *
   * @param bounds the search space
   * @param count number of vectors requested
   * @param exclude raw vectors that must not be returned, e.g. already evaluated ones
   * @param mode whether falling short of {@code count} is an error
   * @return distinct vectors inside {@code bounds}, exactly {@code count} of them in strict mode
   * @throws InsufficientUniqueSamplesException in strict mode when the retry budget runs out
   */
  ImmutableList<ImmutableList<Double>> sample(
      BoundsTable bounds, int count, Set<ImmutableList<Double>> exclude, SamplingMode mode);

  default ImmutableList<ImmutableList<Double>> sample(BoundsTable bounds, int count) {
    return sample(bounds, count, ImmutableSet.of(), SamplingMode.STRICT);
  }
}
