package com.verlumen.bayesopt.acquisition;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Exploration parameters of the acquisition functions. */
@AutoValue
public abstract class AcquisitionParams {
  public static final double DEFAULT_KAPPA = 2.576;
  public static final double DEFAULT_EPS = 0.0;

  public static AcquisitionParams create(double kappa, double eps) {
    checkArgument(Double.isFinite(kappa), "kappa must be finite: %s", kappa);
    checkArgument(Double.isFinite(eps), "eps must be finite: %s", eps);
    return new AutoValue_AcquisitionParams(kappa, eps);
  }

  public static AcquisitionParams defaults() {
    return create(DEFAULT_KAPPA, DEFAULT_EPS);
  }

  /** Weight of the posterior standard deviation in UCB. */
  public abstract double kappa();

  /** Margin added to the incumbent before measuring improvement in EI, EIPS and POI. */
  public abstract double eps();
}
