package com.verlumen.bayesopt.surrogate;

/** Posterior mean and variance of the surrogate at one point. */
public record Posterior(double mean, double variance) {
  public Posterior {
    if (variance < 0.0 || Double.isNaN(variance)) {
      throw new IllegalArgumentException("Posterior variance must be non-negative: " + variance);
    }
  }

  public double standardDeviation() {
    return Math.sqrt(variance);
  }
}
