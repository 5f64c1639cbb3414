package com.verlumen.bayesopt.acquisition;

import com.verlumen.bayesopt.orchestration.ConfigurationException;

/** Raised when an acquisition function name is not one of ucb, ei, eips or poi. */
public final class UnrecognizedAcquisitionFunctionException extends ConfigurationException {
  public UnrecognizedAcquisitionFunctionException(String name) {
    super("Acquisition function not recognized: " + name + ". Expected one of ucb, ei, eips, poi");
  }
}
