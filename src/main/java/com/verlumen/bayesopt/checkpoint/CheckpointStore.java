package com.verlumen.bayesopt.checkpoint;

import com.verlumen.bayesopt.observations.ObservationLog;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists observation logs as a table with columns {@code Iteration}, the parameters,
 * {@code Elapsed}, {@code Score} and any extras.
 */
public interface CheckpointStore {
  /** Replaces the content of {@code path} with the full log. */
  void save(Path path, ObservationLog log) throws CheckpointWriteException;

  /** Reads a log previously written by {@link #save}, for use as a resumed log. */
  ObservationLog load(Path path) throws IOException;
}
