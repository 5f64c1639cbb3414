package com.verlumen.bayesopt.space;

import com.google.inject.AbstractModule;

public final class SpaceModule extends AbstractModule {
  public static SpaceModule create() {
    return new SpaceModule();
  }

  @Override
  protected void configure() {
    bind(SpaceFillingSampler.class).to(LatinHypercubeSampler.class);
  }

  private SpaceModule() {}
}
