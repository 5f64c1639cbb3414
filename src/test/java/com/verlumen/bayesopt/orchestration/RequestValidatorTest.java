package com.verlumen.bayesopt.orchestration;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.bayesopt.acquisition.ImpatienceRule;
import com.verlumen.bayesopt.acquisition.UnrecognizedAcquisitionFunctionException;
import com.verlumen.bayesopt.evaluation.ScoreResult;
import com.verlumen.bayesopt.observations.Observation;
import com.verlumen.bayesopt.observations.ObservationLog;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.ParameterSpec;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RequestValidatorTest {
  private static final BoundsTable BOUNDS =
      BoundsTable.of(ParameterSpec.continuous("x", 0, 1), ParameterSpec.integer("n", 1, 4));

  @Inject private RequestValidator validator;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void validate_consistentRequest_passes() {
    validator.validate(request(config().setInitPoints(3).setNIters(6)).build());
  }

  @Test
  public void validate_unknownAcquisition_throws() {
    assertThrows(
        UnrecognizedAcquisitionFunctionException.class,
        () ->
            validator.validate(
                request(config().setInitPoints(3).setNIters(6).setAcquisition("lcb")).build()));
  }

  @Test
  public void validate_unknownImpatienceReplacement_throws() {
    assertThrows(
        UnrecognizedAcquisitionFunctionException.class,
        () ->
            validator.validate(
                request(
                        config()
                            .setInitPoints(3)
                            .setNIters(6)
                            .setAcquisition("eips")
                            .setImpatience(ImpatienceRule.create("greedy", 4)))
                    .build()));
  }

  @Test
  public void validate_noInitializationWithoutResumedLog_throws() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () ->
                validator.validate(
                    request(config().setInitialize(false).setNIters(6)).build()));

    assertThat(e).hasMessageThat().contains("resumed log");
  }

  @Test
  public void validate_neitherGridNorInitPoints_throws() {
    assertThrows(
        ConfigurationException.class,
        () -> validator.validate(request(config().setNIters(6)).build()));
  }

  @Test
  public void validate_gridAndInitPoints_throws() {
    assertThrows(
        ConfigurationException.class,
        () ->
            validator.validate(
                request(config().setInitPoints(2).setNIters(6))
                    .setInitialGrid(ImmutableList.of(ImmutableList.of(0.5, 2.0)))
                    .build()));
  }

  @Test
  public void validate_parallelWithoutWorkers_throws() {
    assertThrows(
        ConfigurationException.class,
        () ->
            validator.validate(
                request(config().setInitPoints(3).setNIters(6).setParallel(true)).build()));
  }

  @Test
  public void validate_gridOutsideBounds_throwsBoundsViolation() {
    BoundsViolationException e =
        assertThrows(
            BoundsViolationException.class,
            () ->
                validator.validate(
                    request(config().setNIters(6))
                        .setInitialGrid(
                            ImmutableList.of(
                                ImmutableList.of(0.5, 2.0), ImmutableList.of(1.5, 2.0)))
                        .build()));

    assertThat(e).hasMessageThat().contains("1 row");
  }

  @Test
  public void validate_gridRowWithWrongWidth_throws() {
    assertThrows(
        ConfigurationException.class,
        () ->
            validator.validate(
                request(config().setNIters(6))
                    .setInitialGrid(ImmutableList.of(ImmutableList.of(0.5)))
                    .build()));
  }

  @Test
  public void validate_resumedLogOutsideBounds_throwsBoundsViolation() {
    ObservationLog resumed = resumedLog(ImmutableList.of(0.5, 9.0));

    assertThrows(
        BoundsViolationException.class,
        () ->
            validator.validate(
                request(config().setInitialize(false).setNIters(6))
                    .setResumedLog(resumed)
                    .build()));
  }

  @Test
  public void validate_resumedLogWithOtherParameters_throwsWithoutInitialization() {
    ObservationLog resumed = ObservationLog.create(ImmutableList.of("other"));
    resumed.append(
        ImmutableList.of(
            Observation.create(0, ImmutableList.of(1.0), 0.1, 1.0, ImmutableMap.of())));

    assertThrows(
        ConfigurationException.class,
        () ->
            validator.validate(
                request(config().setInitialize(false).setNIters(6))
                    .setResumedLog(resumed)
                    .build()));
  }

  @Test
  public void validate_initialRowsReachNIters_throws() {
    ObservationLog resumed =
        resumedLog(ImmutableList.of(0.1, 1.0), ImmutableList.of(0.2, 2.0));

    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () ->
                validator.validate(
                    request(config().setInitPoints(4).setNIters(6))
                        .setResumedLog(resumed)
                        .build()));

    assertThat(e).hasMessageThat().contains("nIters");
  }

  @Test
  public void validate_resumedOnlyBelowNIters_passes() {
    ObservationLog resumed =
        resumedLog(ImmutableList.of(0.1, 1.0), ImmutableList.of(0.2, 2.0));

    validator.validate(
        request(config().setInitialize(false).setNIters(3)).setResumedLog(resumed).build());
  }

  private static OptimizationConfig.Builder config() {
    return OptimizationConfig.builder().setVerbosity(Verbosity.SILENT);
  }

  private static OptimizationRequest.Builder request(OptimizationConfig.Builder config) {
    return OptimizationRequest.builder()
        .setScoringFunction(parameters -> ScoreResult.of(parameters.get("x")))
        .setBounds(BOUNDS)
        .setConfig(config.build());
  }

  @SafeVarargs
  private static ObservationLog resumedLog(ImmutableList<Double>... rows) {
    ObservationLog log = ObservationLog.create(BOUNDS.names());
    ImmutableList.Builder<Observation> batch = ImmutableList.builder();
    for (ImmutableList<Double> row : rows) {
      batch.add(Observation.create(0, row, 0.1, row.get(0), ImmutableMap.of()));
    }
    log.append(batch.build());
    return log;
  }
}
