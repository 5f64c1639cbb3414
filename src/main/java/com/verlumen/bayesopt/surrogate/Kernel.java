package com.verlumen.bayesopt.surrogate;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * A covariance family paired with its lengthscale parameter. {@code beta} is {@code log10(theta)}
 * where {@code theta} weights squared distances, so larger values mean shorter correlation
 * lengths.
 */
@AutoValue
public abstract class Kernel {
  public static Kernel create(KernelKind kind, double beta) {
    checkArgument(Double.isFinite(beta), "Kernel beta must be finite: %s", beta);
    return new AutoValue_Kernel(kind, beta);
  }

  public static Kernel matern52() {
    return create(KernelKind.MATERN52, 0.0);
  }

  public abstract KernelKind kind();

  public abstract double beta();

  public double theta() {
    return Math.pow(10.0, beta());
  }

  public Kernel withBeta(double newBeta) {
    return create(kind(), newBeta);
  }

  /** Correlation between two points of the unit hypercube. */
  public double correlation(double[] a, double[] b) {
    double squared = 0.0;
    for (int i = 0; i < a.length; i++) {
      double diff = a[i] - b[i];
      squared += diff * diff;
    }
    return kind().correlation(theta() * squared);
  }
}
