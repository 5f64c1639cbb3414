package com.verlumen.bayesopt.orchestration;

/** How much the orchestrator reports while it runs. */
public enum Verbosity {
  SILENT,
  /** Round-by-round progress. */
  PROGRESS,
  /** Progress plus every new observation. */
  DETAIL;

  public static Verbosity fromLevel(int level) {
    if (level <= 0) {
      return SILENT;
    }
    return level == 1 ? PROGRESS : DETAIL;
  }

  boolean showsProgress() {
    return this != SILENT;
  }

  boolean showsDetail() {
    return this == DETAIL;
  }
}
