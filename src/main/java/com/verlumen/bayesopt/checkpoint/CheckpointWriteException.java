package com.verlumen.bayesopt.checkpoint;

import java.io.IOException;
import java.nio.file.Path;

/** An observation log could not be written to its checkpoint file. */
public final class CheckpointWriteException extends IOException {
  private final Path path;

  public CheckpointWriteException(Path path, Throwable cause) {
    super("Failed to save intermediate results to " + path, cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
