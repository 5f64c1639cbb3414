package com.verlumen.bayesopt.evaluation;

import com.google.inject.Inject;

final class DispatcherFactoryImpl implements DispatcherFactory {
  @Inject
  DispatcherFactoryImpl() {}

  @Override
  public Dispatcher create(boolean parallel, int workers) {
    return parallel ? new WorkerPoolDispatcher(workers) : new SequentialDispatcher();
  }
}
