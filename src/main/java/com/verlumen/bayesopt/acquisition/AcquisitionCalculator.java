package com.verlumen.bayesopt.acquisition;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.inject.Inject;
import com.verlumen.bayesopt.surrogate.Posterior;
import org.apache.commons.math3.distribution.NormalDistribution;

/** Evaluates acquisition functions from posterior summaries of the surrogate(s). */
public final class AcquisitionCalculator {
  /** Floor for predicted (scaled) evaluation time in EIPS. */
  static final double MIN_PREDICTED_ELAPSED = 1e-6;

  private final NormalDistribution standardNormal = new NormalDistribution(null, 0.0, 1.0);

  @Inject
  AcquisitionCalculator() {}

  /**
   * @param function the acquisition function
   * @param score posterior of the (scaled) score surrogate at the point
   * @param elapsed posterior of the (scaled) elapsed-time surrogate, required for EIPS only
   * @param yMax best scaled score observed so far
   * @param params exploration parameters
   */
  public double utility(
      AcquisitionFunction function,
      Posterior score,
      Posterior elapsed,
      double yMax,
      AcquisitionParams params) {
    switch (function) {
      case UCB:
        return upperConfidenceBound(score, params.kappa());
      case EI:
        return expectedImprovement(score, yMax + params.eps());
      case EIPS:
        checkNotNull(elapsed, "EIPS requires an elapsed-time posterior");
        return expectedImprovement(score, yMax + params.eps())
            / Math.max(elapsed.mean(), MIN_PREDICTED_ELAPSED);
      case POI:
        return probabilityOfImprovement(score, yMax + params.eps());
    }
    throw new AssertionError("Unhandled acquisition function: " + function);
  }

  double upperConfidenceBound(Posterior score, double kappa) {
    return score.mean() + kappa * score.standardDeviation();
  }

  double expectedImprovement(Posterior score, double threshold) {
    double improvement = score.mean() - threshold;
    double sd = score.standardDeviation();
    if (sd == 0.0) {
      return Math.max(improvement, 0.0);
    }
    double z = improvement / sd;
    double value =
        improvement * standardNormal.cumulativeProbability(z) + sd * standardNormal.density(z);
    // Cancellation for very negative z can leave a tiny negative value.
    return Math.max(value, 0.0);
  }

  double probabilityOfImprovement(Posterior score, double threshold) {
    double improvement = score.mean() - threshold;
    double sd = score.standardDeviation();
    if (sd == 0.0) {
      return improvement > 0.0 ? 1.0 : 0.0;
    }
    return standardNormal.cumulativeProbability(improvement / sd);
  }
}
