package com.verlumen.bayesopt.cluster;

import com.google.inject.AbstractModule;

public final class ClusterModule extends AbstractModule {
  public static ClusterModule create() {
    return new ClusterModule();
  }

  @Override
  protected void configure() {
    bind(CandidateClusterer.class).to(CandidateClustererImpl.class);
  }

  private ClusterModule() {}
}
