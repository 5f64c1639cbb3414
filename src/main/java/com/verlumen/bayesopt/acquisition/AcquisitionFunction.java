package com.verlumen.bayesopt.acquisition;

import java.util.Locale;

/** Utility functions used to rank candidate points under the surrogate posterior. */
public enum AcquisitionFunction {
  /** Upper confidence bound. */
  UCB("ucb"),
  /** Expected improvement. */
  EI("ei"),
  /** Expected improvement per second of predicted evaluation time. */
  EIPS("eips"),
  /** Probability of improvement. */
  POI("poi");

  private final String shortName;

  AcquisitionFunction(String shortName) {
    this.shortName = shortName;
  }

  public String shortName() {
    return shortName;
  }

  /** Whether this function needs a second surrogate fitted on evaluation times. */
  public boolean requiresElapsedModel() {
    return this == EIPS;
  }

  public static AcquisitionFunction fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (AcquisitionFunction function : values()) {
        if (function.shortName.equals(normalized)) {
          return function;
        }
      }
    }
    throw new UnrecognizedAcquisitionFunctionException(name);
  }
}
