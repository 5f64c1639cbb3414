package com.verlumen.bayesopt.surrogate;

/**
 * Regression model over points of the unit hypercube. Inputs are scaled parameter vectors and
 * outputs are scaled scores (or elapsed times).
 */
public interface SurrogateModel {
  /** Builds a fresh model with the given kernel family and starting hyperparameters. */
  SurrogateHandle fit(Kernel kernel, double[][] x, double[] y);

  /**
   * Conditions an existing model on additional observations, re-estimating its noise term, and
   * returns the resulting model as a new handle.
   */
  SurrogateHandle update(SurrogateHandle handle, double[][] xNew, double[] yNew);

  Posterior predict(SurrogateHandle handle, double[] x);
}
