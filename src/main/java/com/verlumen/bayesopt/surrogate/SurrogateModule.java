package com.verlumen.bayesopt.surrogate;

import com.google.inject.AbstractModule;

public final class SurrogateModule extends AbstractModule {
  public static SurrogateModule create() {
    return new SurrogateModule();
  }

  @Override
  protected void configure() {
    bind(SurrogateModel.class).to(GaussianProcessModel.class);
  }

  private SurrogateModule() {}
}
