package com.verlumen.bayesopt.acquisition;

import com.google.inject.AbstractModule;

public final class AcquisitionModule extends AbstractModule {
  public static AcquisitionModule create() {
    return new AcquisitionModule();
  }

  @Override
  protected void configure() {
    bind(AcquisitionMaximizer.class).to(AcquisitionMaximizerImpl.class);
  }

  private AcquisitionModule() {}
}
