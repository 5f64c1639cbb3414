package com.verlumen.bayesopt.orchestration;

/** An optimization request is invalid; raised before any evaluation happens. */
public class ConfigurationException extends IllegalArgumentException {
  public ConfigurationException(String message) {
    super(message);
  }
}
