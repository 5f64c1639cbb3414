package com.verlumen.bayesopt.evaluation;

import com.google.common.collect.ImmutableMap;

/**
 * The expensive black box being maximized. Implementations may be invoked concurrently from
 * several worker threads and must not share mutable state between invocations.
 */
@FunctionalInterface
public interface ScoringFunction {
  /**
   * @param parameters parameter values keyed by name, integer parameters holding whole numbers
   * @return the score and any extra values to record alongside it
   * @throws Exception any failure; it aborts the optimization run
   */
  ScoreResult score(ImmutableMap<String, Double> parameters) throws Exception;
}
