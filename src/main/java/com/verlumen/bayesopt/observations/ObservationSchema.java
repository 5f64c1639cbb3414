package com.verlumen.bayesopt.observations;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Column layout of an observation table: {@code Iteration}, the parameter columns in declared
 * order, {@code Elapsed}, {@code Score}, then any extra columns returned by the scoring function.
 */
@AutoValue
public abstract class ObservationSchema {
  public static final String ITERATION = "Iteration";
  public static final String ELAPSED = "Elapsed";
  public static final String SCORE = "Score";
  public static final ImmutableSet<String> RESERVED = ImmutableSet.of(ITERATION, ELAPSED, SCORE);

  public static ObservationSchema create(List<String> parameterNames, List<String> extraNames) {
    checkArgument(!parameterNames.isEmpty(), "At least one parameter column is required");
    Set<String> seen = new HashSet<>();
    for (String name : parameterNames) {
      checkArgument(!RESERVED.contains(name), "Parameter name %s is reserved", name);
      checkArgument(seen.add(name), "Duplicate column %s", name);
    }
    for (String name : extraNames) {
      checkArgument(!RESERVED.contains(name), "Extra column name %s is reserved", name);
      checkArgument(seen.add(name), "Extra column %s clashes with another column", name);
    }
    return new AutoValue_ObservationSchema(
        ImmutableList.copyOf(parameterNames), ImmutableList.copyOf(extraNames));
  }

  public abstract ImmutableList<String> parameterNames();

  public abstract ImmutableList<String> extraNames();

  /** All columns in table order. */
  public ImmutableList<String> columns() {
    return ImmutableList.<String>builder()
        .add(ITERATION)
        .addAll(parameterNames())
        .add(ELAPSED, SCORE)
        .addAll(extraNames())
        .build();
  }

  /** True when both schemas have the same set of column names, regardless of order. */
  public boolean sameColumnsAs(ObservationSchema other) {
    return ImmutableSet.copyOf(columns()).equals(ImmutableSet.copyOf(other.columns()))
        && columns().size() == other.columns().size();
  }
}
