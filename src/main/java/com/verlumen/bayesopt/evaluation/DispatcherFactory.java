package com.verlumen.bayesopt.evaluation;

/** Chooses between sequential and pooled evaluation. */
public interface DispatcherFactory {
  /**
   * @param parallel whether candidates should be scored concurrently
   * @param workers size of the worker pool; must exceed 1 when {@code parallel} is set
   */
  Dispatcher create(boolean parallel, int workers);
}
