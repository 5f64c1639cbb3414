package com.verlumen.bayesopt.checkpoint;

import com.google.inject.AbstractModule;

public final class CheckpointModule extends AbstractModule {
  public static CheckpointModule create() {
    return new CheckpointModule();
  }

  @Override
  protected void configure() {
    bind(CheckpointStore.class).to(JsonCheckpointStore.class);
  }

  private CheckpointModule() {}
}
