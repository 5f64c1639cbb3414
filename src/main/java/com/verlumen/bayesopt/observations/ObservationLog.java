package com.verlumen.bayesopt.observations;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only table of observations. Rows arrive in whole batches and are never removed; the
 * extra columns are fixed by the first batch appended.
 */
public final class ObservationLog {
  private final ImmutableList<String> parameterNames;
  private final List<Observation> rows = new ArrayList<>();
  private final Set<ImmutableList<Double>> distinctParameters = new LinkedHashSet<>();
  private ObservationSchema schema;

  private ObservationLog(ImmutableList<String> parameterNames, ObservationSchema schema) {
    this.parameterNames = parameterNames;
    this.schema = schema;
  }

  /** An empty log whose extra columns are taken from the first batch. */
  public static ObservationLog create(List<String> parameterNames) {
    return new ObservationLog(ImmutableList.copyOf(parameterNames), null);
  }

  /** An empty log with a known schema, e.g. one read back from a checkpoint. */
  public static ObservationLog create(ObservationSchema schema) {
    return new ObservationLog(schema.parameterNames(), schema);
  }

  /**
   * Appends a batch. The batch is validated as a whole before any row is added.
   *
   * @throws IllegalArgumentException if a row does not fit the schema or would move the
   *     iteration column backwards
   */
  public void append(List<Observation> batch) {
    checkArgument(!batch.isEmpty(), "Cannot append an empty batch");
    ObservationSchema batchSchema =
        schema != null
            ? schema
            : ObservationSchema.create(
                parameterNames, ImmutableList.copyOf(batch.get(0).extras().keySet()));
    ImmutableSet<String> expectedExtras = ImmutableSet.copyOf(batchSchema.extraNames());
    int lastIteration = rows.isEmpty() ? 0 : rows.get(rows.size() - 1).iteration();
    for (Observation row : batch) {
      checkNotNull(row, "Batch contains a null observation");
      checkArgument(
          row.parameters().size() == parameterNames.size(),
          "Expected %s parameter values but got %s",
          parameterNames.size(),
          row.parameters().size());
      checkArgument(
          row.extras().keySet().equals(expectedExtras),
          "Extra columns %s do not match the log's extra columns %s",
          row.extras().keySet(),
          expectedExtras);
      checkArgument(
          row.iteration() >= lastIteration,
          "Iteration %s would precede iteration %s already in the log",
          row.iteration(),
          lastIteration);
      lastIteration = row.iteration();
    }
    schema = batchSchema;
    for (Observation row : batch) {
      rows.add(row);
      distinctParameters.add(row.parameters());
    }
  }

  public ImmutableList<String> parameterNames() {
    return parameterNames;
  }

  /** Schema of the log; empty until the first batch is appended to a log created without one. */
  public Optional<ObservationSchema> schema() {
    return Optional.ofNullable(schema);
  }

  public ImmutableList<Observation> observations() {
    return ImmutableList.copyOf(rows);
  }

  public ImmutableList<Observation> atIteration(int iteration) {
    return rows.stream()
        .filter(row -> row.iteration() == iteration)
        .collect(ImmutableList.toImmutableList());
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Number of distinct parameter vectors scored so far. */
  public int distinctCount() {
    return distinctParameters.size();
  }

  public ImmutableSet<ImmutableList<Double>> distinctParameters() {
    return ImmutableSet.copyOf(distinctParameters);
  }

  public boolean contains(ImmutableList<Double> parameters) {
    return distinctParameters.contains(parameters);
  }

  /** Highest-scoring row; the earliest one wins ties. */
  public Optional<Observation> best() {
    Observation best = null;
    for (Observation row : rows) {
      if (best == null || row.score() > best.score()) {
        best = row;
      }
    }
    return Optional.ofNullable(best);
  }

  public double maxAbsScore() {
    return rows.stream().mapToDouble(row -> Math.abs(row.score())).max().orElse(0.0);
  }

  public double maxElapsed() {
    return rows.stream().mapToDouble(Observation::elapsedSeconds).max().orElse(0.0);
  }

  public int lastIteration() {
    return rows.stream().map(Observation::iteration).max(Comparator.naturalOrder()).orElse(0);
  }
}
