package com.verlumen.bayesopt.cli;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.bayesopt.evaluation.ScoreResult;
import com.verlumen.bayesopt.evaluation.ScoringFunction;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.ParameterSpec;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;

/** Built-in scoring functions for trying the optimizer from the command line. */
enum DemoFunction implements ScoringFunction {
  /** Sum of three normal densities on [0, 15]; the global maximum is near x = 7. */
  BUMPS(
      BoundsTable.of(ParameterSpec.continuous("x", 0, 15)),
      ImmutableList.of(ImmutableList.of(0.0), ImmutableList.of(5.0), ImmutableList.of(10.0))) {
    @Override
    public ScoreResult score(ImmutableMap<String, Double> parameters) {
      double x = parameters.get("x");
      return ScoreResult.of(
          LEFT_BUMP.density(x) * 1.5 + MIDDLE_BUMP.density(x) + RIGHT_BUMP.density(x));
    }
  },

  /**
   * Integer tree depth and continuous learning rate with an optimum at depth 6, rate 0.1. Also
   * reports the cost of the setting as an extra column.
   */
  MIXED(
      BoundsTable.of(
          ParameterSpec.integer("depth", 1, 12), ParameterSpec.continuous("rate", 0.001, 1.0)),
      ImmutableList.of(
          ImmutableList.of(2.0, 0.01),
          ImmutableList.of(4.0, 0.5),
          ImmutableList.of(9.0, 0.002),
          ImmutableList.of(11.0, 0.2))) {
    @Override
    public ScoreResult score(ImmutableMap<String, Double> parameters) {
      double depth = parameters.get("depth");
      double logRate = Math.log10(parameters.get("rate"));
      double score = -Math.pow(depth - 6, 2) / 10 - Math.pow(logRate + 1, 2);
      return ScoreResult.create(score, Map.of("cost", depth / parameters.get("rate")));
    }
  };

  private static final NormalDistribution LEFT_BUMP = new NormalDistribution(null, 3, 2);
  private static final NormalDistribution MIDDLE_BUMP = new NormalDistribution(null, 7, 1);
  private static final NormalDistribution RIGHT_BUMP = new NormalDistribution(null, 10, 2);

  private final BoundsTable bounds;
  private final ImmutableList<ImmutableList<Double>> suggestedGrid;

  DemoFunction(BoundsTable bounds, ImmutableList<ImmutableList<Double>> suggestedGrid) {
    this.bounds = bounds;
    this.suggestedGrid = suggestedGrid;
  }

  BoundsTable bounds() {
    return bounds;
  }

  /** Initial design used when no latin hypercube size is given. */
  ImmutableList<ImmutableList<Double>> suggestedGrid() {
    return suggestedGrid;
  }

  static DemoFunction fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
