package com.verlumen.bayesopt.space;

/** Value domain of a single tunable parameter. */
public enum ParameterKind {
  CONTINUOUS,
  /** Values are rounded to the nearest integer when mapped back from the unit interval. */
  INTEGER;

  /** Rounds integer values; also maps -0.0 to 0.0 so that equal vectors compare equal. */
  double round(double value) {
    return (this == INTEGER ? Math.rint(value) : value) + 0.0;
  }
}
