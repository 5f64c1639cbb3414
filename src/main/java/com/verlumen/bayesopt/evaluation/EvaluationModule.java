package com.verlumen.bayesopt.evaluation;

import com.google.inject.AbstractModule;

public final class EvaluationModule extends AbstractModule {
  public static EvaluationModule create() {
    return new EvaluationModule();
  }

  @Override
  protected void configure() {
    bind(DispatcherFactory.class).to(DispatcherFactoryImpl.class);
  }

  private EvaluationModule() {}
}
