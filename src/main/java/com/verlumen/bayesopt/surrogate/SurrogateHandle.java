package com.verlumen.bayesopt.surrogate;

/**
 * Opaque, immutable reference to a fitted regression model. A refit or update produces a new
 * handle; existing handles are never modified.
 */
public interface SurrogateHandle {
  /** Kernel with the hyperparameters selected by the most recent fit. */
  Kernel kernel();

  /** Number of observations the model has been conditioned on. */
  int observationCount();
}
