package com.verlumen.bayesopt.cli;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.bayesopt.acquisition.ImpatienceRule;
import com.verlumen.bayesopt.checkpoint.CheckpointStore;
import com.verlumen.bayesopt.orchestration.ConfigurationException;
import com.verlumen.bayesopt.orchestration.OptimizationConfig;
import com.verlumen.bayesopt.orchestration.OptimizationModule;
import com.verlumen.bayesopt.orchestration.OptimizationResult;
import com.verlumen.bayesopt.orchestration.Verbosity;
import com.verlumen.bayesopt.surrogate.KernelKind;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AppTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Inject private App app;
  @Inject private CheckpointStore checkpointStore;

  @Before
  public void setUp() {
    Guice.createInjector(OptimizationModule.create(7)).injectMembers(this);
  }

  @Test
  public void buildConfig_defaults() throws Exception {
    OptimizationConfig config = App.buildConfig(parse());

    assertThat(config.initialize()).isTrue();
    assertThat(config.initPoints()).isEqualTo(0);
    assertThat(config.nIters()).isEqualTo(12);
    assertThat(config.kernel().kind()).isEqualTo(KernelKind.MATERN52);
    assertThat(config.acquisition()).isEqualTo("ucb");
    assertThat(config.impatience()).isEqualTo(ImpatienceRule.never());
    assertThat(config.verbosity()).isEqualTo(Verbosity.PROGRESS);
    assertThat(config.parallel()).isFalse();
    assertThat(config.checkpointPath()).isEmpty();
    assertThat(config.minClusterUtility()).isEmpty();
  }

  @Test
  public void buildConfig_mapsOptions() throws Exception {
    OptimizationConfig config =
        App.buildConfig(
            parse(
                "--acq", "eips",
                "--impatienceRounds", "8",
                "--newAcq", "ei",
                "--kernel", "exponential",
                "--minClusterUtility", "0.5",
                "--checkpoint", "runs/out.json",
                "--parallelism", "4",
                "--bulkNew", "4",
                "--verbose", "2"));

    assertThat(config.acquisition()).isEqualTo("eips");
    assertThat(config.impatience()).isEqualTo(ImpatienceRule.create("ei", 8));
    assertThat(config.kernel().kind()).isEqualTo(KernelKind.EXPONENTIAL);
    assertThat(config.minClusterUtility()).hasValue(0.5);
    assertThat(config.checkpointPath()).hasValue(Paths.get("runs/out.json"));
    assertThat(config.parallel()).isTrue();
    assertThat(config.parallelism()).isEqualTo(4);
    assertThat(config.bulkNew()).isEqualTo(4);
    assertThat(config.verbosity()).isEqualTo(Verbosity.DETAIL);
  }

  @Test
  public void parseArgs_unknownAcquisition_throws() {
    assertThrows(ArgumentParserException.class, () -> parse("--acq", "lcb"));
  }

  @Test
  public void run_bumpsWithSuggestedGrid() throws Exception {
    OptimizationResult result = app.run(parse("--nIters", "6", "--gsPoints", "10"));

    assertThat(result.observations()).hasSize(6);
    assertThat(result.observations().get(0).parameters()).containsExactly(0.0);
  }

  @Test
  public void run_mixedKeepsCostColumnAndIntegerDepth() throws Exception {
    OptimizationResult result =
        app.run(parse("--function", "mixed", "--nIters", "7", "--gsPoints", "10"));

    assertThat(result.schema().extraNames()).containsExactly("cost");
    for (int i = 0; i < result.observations().size(); i++) {
      double depth = result.observations().get(i).parameters().get(0);
      assertThat(depth).isEqualTo(Math.rint(depth));
    }
  }

  @Test
  public void run_resumesFromCheckpoint() throws Exception {
    Path checkpoint = temporaryFolder.getRoot().toPath().resolve("bumps.json");
    app.run(
        parse("--nIters", "5", "--gsPoints", "10", "--checkpoint", checkpoint.toString()));

    OptimizationResult resumed =
        app.run(
            parse(
                "--skipInitialization",
                "--resume", checkpoint.toString(),
                "--nIters", "7",
                "--gsPoints", "10"));

    assertThat(resumed.observations()).hasSize(7);
    assertThat(checkpointStore.load(checkpoint).size()).isEqualTo(5);
  }

  @Test
  public void run_tooFewIterations_throws() {
    assertThrows(ConfigurationException.class, () -> app.run(parse("--nIters", "3")));
  }

  @Test
  public void bumps_peaksNearSeven() throws Exception {
    double atSeven = DemoFunction.BUMPS.score(ImmutableMap.of("x", 7.0)).score();

    assertThat(atSeven).isGreaterThan(DemoFunction.BUMPS.score(ImmutableMap.of("x", 3.0)).score());
    assertThat(atSeven).isGreaterThan(DemoFunction.BUMPS.score(ImmutableMap.of("x", 12.0)).score());
  }

  @Test
  public void mixed_optimumAtDepthSixRateOneTenth() throws Exception {
    assertThat(
            DemoFunction.MIXED.score(ImmutableMap.of("depth", 6.0, "rate", 0.1)).score())
        .isWithin(1e-12)
        .of(0.0);
    assertThat(DemoFunction.fromName("Mixed")).isEqualTo(DemoFunction.MIXED);
  }

  private static Namespace parse(String... args) throws ArgumentParserException {
    return App.createParser().parseArgs(args);
  }
}
