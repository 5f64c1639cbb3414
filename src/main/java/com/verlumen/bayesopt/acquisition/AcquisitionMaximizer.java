package com.verlumen.bayesopt.acquisition;

import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.space.BoundsTable;

/** Searches the unit hypercube for local maxima of an acquisition surface. */
public interface AcquisitionMaximizer {
  /**
   * Runs one bounded local search from each of {@code starts} space-filling starting points.
   *
   * @param surface the acquisition surface to maximize
   * @param bounds the search space
   * @param starts number of starting points requested; fewer are used if integer rounding
   *     leaves too few distinct ones
   * @param convergenceFactor relative-reduction tolerance in multiples of machine epsilon
   * @return one local optimum per starting point
   */
  ImmutableList<LocalOptimum> maximize(
      AcquisitionSurface surface, BoundsTable bounds, int starts, double convergenceFactor);
}
