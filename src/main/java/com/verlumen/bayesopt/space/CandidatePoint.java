package com.verlumen.bayesopt.space;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

/** A parameter vector in raw units together with its unit-hypercube coordinates. */
@AutoValue
public abstract class CandidatePoint {
  /** Clips {@code scaled} to the unit hypercube and derives raw units from it. */
  public static CandidatePoint fromScaled(BoundsTable bounds, double[] scaled) {
    double[] clipped = new double[scaled.length];
    for (int i = 0; i < scaled.length; i++) {
      clipped[i] = Math.min(1.0, Math.max(0.0, scaled[i]));
    }
    return new AutoValue_CandidatePoint(
        bounds.unscaleToList(clipped), ImmutableList.copyOf(Doubles.asList(clipped)));
  }

  public static CandidatePoint fromRaw(BoundsTable bounds, ImmutableList<Double> raw) {
    ImmutableList<Double> normalized =
        raw.stream().map(value -> value + 0.0).collect(ImmutableList.toImmutableList());
    return new AutoValue_CandidatePoint(
        normalized,
        ImmutableList.copyOf(Doubles.asList(bounds.scale(Doubles.toArray(normalized)))));
  }

  public abstract ImmutableList<Double> raw();

  public abstract ImmutableList<Double> scaled();

  public double[] scaledArray() {
    return Doubles.toArray(scaled());
  }
}
