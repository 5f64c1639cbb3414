package com.verlumen.bayesopt.orchestration;

/** Runs Bayesian optimization of a scoring function over a bounded parameter space. */
public interface OptimizationOrchestrator {
  /**
   * Validates the request, scores the initial design, then alternates surrogate fitting,
   * acquisition search and batch scoring until {@code nIters} distinct parameter sets have been
   * scored.
   *
   * @throws ConfigurationException if the request is inconsistent; nothing is scored in that case
   * @throws com.verlumen.bayesopt.evaluation.EvaluationException if the scoring function fails;
   *     the run is aborted
   * @throws com.verlumen.bayesopt.space.InsufficientUniqueSamplesException if no initial design of
   *     the requested size exists in the space
   */
  OptimizationResult run(OptimizationRequest request);
}
