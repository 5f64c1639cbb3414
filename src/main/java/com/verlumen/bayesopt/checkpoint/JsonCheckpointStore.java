package com.verlumen.bayesopt.checkpoint;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.inject.Inject;
import com.verlumen.bayesopt.observations.Observation;
import com.verlumen.bayesopt.observations.ObservationLog;
import com.verlumen.bayesopt.observations.ObservationSchema;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores the observation table as a JSON document holding the column names and one array of
 * numbers per row. The file is written next to its target and moved into place, so readers never
 * see a half-written table.
 */
final class JsonCheckpointStore implements CheckpointStore {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Gson GSON = new GsonBuilder().create();

  @Inject
  JsonCheckpointStore() {}

  /** Serialized form of the table. */
  private static final class Table {
    List<String> columns;
    List<List<Double>> rows;
  }

  @Override
  public void save(Path path, ObservationLog log) throws CheckpointWriteException {
    ObservationSchema schema =
        log.schema().orElseGet(() -> ObservationSchema.create(log.parameterNames(), List.of()));
    Table table = new Table();
    table.columns = schema.columns();
    table.rows = new ArrayList<>();
    for (Observation row : log.observations()) {
      List<Double> values = new ArrayList<>(table.columns.size());
      values.add((double) row.iteration());
      values.addAll(row.parameters());
      values.add(row.elapsedSeconds());
      values.add(row.score());
      for (String extra : schema.extraNames()) {
        values.add(row.extras().get(extra));
      }
      table.rows.add(values);
    }

    try {
      Path absolute = path.toAbsolutePath();
      Path temp =
          Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
      try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        GSON.toJson(table, writer);
      }
      try {
        Files.move(
            temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException | RuntimeException e) {
      throw new CheckpointWriteException(path, e);
    }
    logger.atFine().log("Wrote %d rows to %s", log.size(), path);
  }

  @Override
  public ObservationLog load(Path path) throws IOException {
    Table table;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      table = GSON.fromJson(reader, Table.class);
    } catch (JsonParseException e) {
      throw new IOException("Malformed checkpoint file " + path, e);
    }
    if (table == null || table.columns == null) {
      throw new IOException("Checkpoint file " + path + " has no column header");
    }

    ObservationSchema schema = parseSchema(path, table.columns);
    ObservationLog log = ObservationLog.create(schema);
    List<Observation> rows = new ArrayList<>();
    int parameterCount = schema.parameterNames().size();
    for (List<Double> values : table.rows == null ? List.<List<Double>>of() : table.rows) {
      if (values == null || values.size() != table.columns.size() || values.contains(null)) {
        throw new IOException(
            "Row " + (rows.size() + 1) + " of " + path + " does not match the header");
      }
      ImmutableMap.Builder<String, Double> extras = ImmutableMap.builder();
      for (int i = 0; i < schema.extraNames().size(); i++) {
        extras.put(schema.extraNames().get(i), values.get(parameterCount + 3 + i));
      }
      rows.add(
          Observation.create(
              values.get(0).intValue(),
              ImmutableList.copyOf(values.subList(1, parameterCount + 1)),
              values.get(parameterCount + 1),
              values.get(parameterCount + 2),
              extras.buildOrThrow()));
    }
    if (!rows.isEmpty()) {
      try {
        log.append(rows);
      } catch (IllegalArgumentException e) {
        throw new IOException("Checkpoint file " + path + " is inconsistent", e);
      }
    }
    logger.atFine().log("Read %d rows from %s", rows.size(), path);
    return log;
  }

  private static ObservationSchema parseSchema(Path path, List<String> columns)
      throws IOException {
    int elapsed = columns.indexOf(ObservationSchema.ELAPSED);
    if (columns.isEmpty()
        || !ObservationSchema.ITERATION.equals(columns.get(0))
        || elapsed < 2
        || elapsed + 1 >= columns.size()
        || !ObservationSchema.SCORE.equals(columns.get(elapsed + 1))) {
      throw new IOException("Unexpected checkpoint columns in " + path + ": " + columns);
    }
    try {
      return ObservationSchema.create(
          columns.subList(1, elapsed), columns.subList(elapsed + 2, columns.size()));
    } catch (IllegalArgumentException e) {
      throw new IOException("Unexpected checkpoint columns in " + path + ": " + columns, e);
    }
  }
}
