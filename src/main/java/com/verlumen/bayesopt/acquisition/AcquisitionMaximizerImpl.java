package com.verlumen.bayesopt.acquisition;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Doubles;
import com.google.inject.Inject;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import com.verlumen.bayesopt.space.SamplingMode;
import com.verlumen.bayesopt.space.SpaceFillingSampler;
import java.util.Arrays;

final class AcquisitionMaximizerImpl implements AcquisitionMaximizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Runs taking more steps than this count as having moved off their starting point. */
  private static final int MIN_INFORMATIVE_STEPS = 2;

  private final SpaceFillingSampler sampler;

  @Inject
  AcquisitionMaximizerImpl(SpaceFillingSampler sampler) {
    this.sampler = sampler;
  }

  @Override
  public ImmutableList<LocalOptimum> maximize(
      AcquisitionSurface surface, BoundsTable bounds, int starts, double convergenceFactor) {
    ImmutableList<ImmutableList<Double>> startPoints =
        sampler.sample(bounds, starts, ImmutableSet.of(), SamplingMode.BEST_EFFORT);
    BoundedLbfgsOptimizer optimizer = new BoundedLbfgsOptimizer(convergenceFactor);
    double[] lower = new double[bounds.dimension()];
    double[] upper = new double[bounds.dimension()];
    Arrays.fill(upper, 1.0);

    ImmutableList.Builder<LocalOptimum> optima = ImmutableList.builder();
    int informative = 0;
    for (ImmutableList<Double> start : startPoints) {
      BoundedLbfgsOptimizer.Result result =
          optimizer.minimize(
              point -> -surface.value(point),
              bounds.scale(Doubles.toArray(start)),
              lower,
              upper);
      if (result.gradientEvaluations() > MIN_INFORMATIVE_STEPS) {
        informative++;
      }
      optima.add(
          LocalOptimum.create(
              CandidatePoint.fromScaled(bounds, result.point()),
              -result.value(),
              result.gradientEvaluations()));
    }

    if (informative == 0 && !startPoints.isEmpty()) {
      logger.atWarning().log(
          "Local optimizer took fewer than 3 steps from all %d starting points. The acquisition"
              + " surface may be flat and the process may be sampling random points; try"
              + " decreasing convThresh.",
          startPoints.size());
    }
    return optima.build();
  }
}
