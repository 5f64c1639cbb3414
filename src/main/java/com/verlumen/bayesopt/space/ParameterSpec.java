package com.verlumen.bayesopt.space;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.auto.value.AutoValue;

/** Name, closed range and kind of one dimension of the search space. */
@AutoValue
public abstract class ParameterSpec {
  public static ParameterSpec continuous(String name, double lower, double upper) {
    return create(name, lower, upper, ParameterKind.CONTINUOUS);
  }

  public static ParameterSpec integer(String name, long lower, long upper) {
    return create(name, lower, upper, ParameterKind.INTEGER);
  }

  public static ParameterSpec create(String name, double lower, double upper, ParameterKind kind) {
    checkArgument(!isNullOrEmpty(name), "Parameter name cannot be empty");
    checkArgument(
        Double.isFinite(lower) && Double.isFinite(upper),
        "Bounds of %s must be finite: [%s, %s]",
        name,
        lower,
        upper);
    checkArgument(
        upper > lower, "Upper bound of %s must exceed lower bound: [%s, %s]", name, lower, upper);
    return new AutoValue_ParameterSpec(name, lower, upper, kind);
  }

  public abstract String name();

  public abstract double lower();

  public abstract double upper();

  public abstract ParameterKind kind();

  public double range() {
    return upper() - lower();
  }

  public boolean contains(double value) {
    return value >= lower() && value <= upper();
  }
}
