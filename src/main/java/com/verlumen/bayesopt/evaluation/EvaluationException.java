package com.verlumen.bayesopt.evaluation;

import com.google.common.collect.ImmutableMap;

/** The scoring function failed for a candidate; the whole batch and the run are abandoned. */
public final class EvaluationException extends RuntimeException {
  private final ImmutableMap<String, Double> parameters;

  public EvaluationException(ImmutableMap<String, Double> parameters, Throwable cause) {
    super("Scoring function failed for parameters " + parameters + ": " + cause, cause);
    this.parameters = parameters;
  }

  EvaluationException(String message, Throwable cause) {
    super(message, cause);
    this.parameters = ImmutableMap.of();
  }

  /** Parameters of the failing candidate, empty if the failure was not tied to one. */
  public ImmutableMap<String, Double> parameters() {
    return parameters;
  }
}
