package com.verlumen.bayesopt.space;

/** Raised when a strict sampling request cannot produce enough distinct parameter vectors. */
public final class InsufficientUniqueSamplesException extends IllegalStateException {
  private final int requested;
  private final int obtained;

  public InsufficientUniqueSamplesException(int requested, int obtained, int attempts) {
    super(
        String.format(
            "Latin hypercube sampling produced only %d of %d distinct parameter sets after %d"
                + " attempts. Try decreasing the number of requested points (initPoints or"
                + " gsPoints).",
            obtained, requested, attempts));
    this.requested = requested;
    this.obtained = obtained;
  }

  public int requested() {
    return requested;
  }

  public int obtained() {
    return obtained;
  }
}
