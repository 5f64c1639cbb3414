package com.verlumen.bayesopt.space;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable set of parameter specifications defining the search space.
 *
 * <p>Maps raw parameter vectors onto the unit hypercube with {@code (x - L) / (U - L)} and back,
 * rounding integer dimensions on the way back.
 */
public final class BoundsTable {
  private final ImmutableList<ParameterSpec> specs;

  private BoundsTable(ImmutableList<ParameterSpec> specs) {
    this.specs = specs;
  }

  public static BoundsTable of(ParameterSpec... specs) {
    return of(ImmutableList.copyOf(specs));
  }

  public static BoundsTable of(List<ParameterSpec> specs) {
    checkArgument(!specs.isEmpty(), "Bounds must contain at least one parameter");
    Set<String> names = new HashSet<>();
    for (ParameterSpec spec : specs) {
      checkArgument(names.add(spec.name()), "Duplicate parameter name: %s", spec.name());
    }
    return new BoundsTable(ImmutableList.copyOf(specs));
  }

  public ImmutableList<ParameterSpec> specs() {
    return specs;
  }

  public int dimension() {
    return specs.size();
  }

  public ParameterSpec spec(int index) {
    return specs.get(index);
  }

  public ImmutableList<String> names() {
    return specs.stream().map(ParameterSpec::name).collect(ImmutableList.toImmutableList());
  }

  /** Maps a raw vector onto [0,1]^d. */
  public double[] scale(double[] raw) {
    checkDimension(raw.length);
    double[] scaled = new double[raw.length];
    for (int i = 0; i < raw.length; i++) {
      ParameterSpec spec = specs.get(i);
      scaled[i] = (raw[i] - spec.lower()) / spec.range();
    }
    return scaled;
  }

  /** Maps a unit-hypercube vector back to raw units, rounding integer dimensions. */
  public double[] unscale(double[] scaled) {
    checkDimension(scaled.length);
    double[] raw = new double[scaled.length];
    for (int i = 0; i < scaled.length; i++) {
      ParameterSpec spec = specs.get(i);
      raw[i] = spec.kind().round(scaled[i] * spec.range() + spec.lower());
    }
    return raw;
  }

  public ImmutableList<Double> unscaleToList(double[] scaled) {
    return ImmutableList.copyOf(Doubles.asList(unscale(scaled)));
  }

  public boolean checkWithinBounds(double[] raw) {
    checkDimension(raw.length);
    for (int i = 0; i < raw.length; i++) {
      if (!specs.get(i).contains(raw[i])) {
        return false;
      }
    }
    return true;
  }

  public boolean checkWithinBounds(List<Double> raw) {
    return checkWithinBounds(Doubles.toArray(raw));
  }

  /** Names each coordinate of a raw vector, in declaration order. */
  public ImmutableMap<String, Double> toNamedValues(List<Double> raw) {
    checkDimension(raw.size());
    ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
    for (int i = 0; i < raw.size(); i++) {
      builder.put(specs.get(i).name(), raw.get(i));
    }
    return builder.buildOrThrow();
  }

  private void checkDimension(int length) {
    checkArgument(
        length == specs.size(),
        "Expected a vector of dimension %s but got %s",
        specs.size(),
        length);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BoundsTable && ((BoundsTable) o).specs.equals(specs);
  }

  @Override
  public int hashCode() {
    return specs.hashCode();
  }

  @Override
  public String toString() {
    return "BoundsTable" + specs;
  }
}
