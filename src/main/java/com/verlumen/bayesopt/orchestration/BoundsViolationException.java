package com.verlumen.bayesopt.orchestration;

/** A supplied initial grid or resumed log contains rows outside the declared bounds. */
public final class BoundsViolationException extends ConfigurationException {
  public BoundsViolationException(String source, int outsideRows) {
    super(String.format("%s not within bounds: %d row(s) outside", source, outsideRows));
  }
}
