package com.verlumen.bayesopt.acquisition;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.bayesopt.surrogate.Posterior;
import com.verlumen.bayesopt.surrogate.SurrogateState;
import java.util.Optional;

/** Acquisition utility as a function of a point in the unit hypercube. */
@FunctionalInterface
public interface AcquisitionSurface {
  double value(double[] scaledPoint);

  /**
   * Binds an acquisition function to fitted surrogates.
   *
   * @param elapsedSurrogate surrogate of evaluation time, present exactly when {@code function}
   *     requires it
   */
  static AcquisitionSurface of(
      AcquisitionCalculator calculator,
      AcquisitionFunction function,
      SurrogateState scoreSurrogate,
      Optional<SurrogateState> elapsedSurrogate,
      double yMax,
      AcquisitionParams params) {
    checkArgument(
        !function.requiresElapsedModel() || elapsedSurrogate.isPresent(),
        "%s requires an elapsed-time surrogate",
        function);
    return point -> {
      Posterior score = scoreSurrogate.predict(point);
      Posterior elapsed =
          function.requiresElapsedModel() ? elapsedSurrogate.get().predict(point) : null;
      return calculator.utility(function, score, elapsed, yMax, params);
    };
  }
}
