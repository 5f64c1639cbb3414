package com.verlumen.bayesopt.orchestration;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.bayesopt.acquisition.ImpatienceRule;
import com.verlumen.bayesopt.surrogate.KernelKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OptimizationConfigTest {
  @Test
  public void builder_defaults() {
    OptimizationConfig config = OptimizationConfig.builder().build();

    assertThat(config.initialize()).isTrue();
    assertThat(config.bulkNew()).isEqualTo(1);
    assertThat(config.kernel().kind()).isEqualTo(KernelKind.MATERN52);
    assertThat(config.kernel().beta()).isEqualTo(0.0);
    assertThat(config.acquisition()).isEqualTo("ucb");
    assertThat(config.impatience()).isEqualTo(ImpatienceRule.never());
    assertThat(config.kappa()).isEqualTo(2.576);
    assertThat(config.eps()).isEqualTo(0.0);
    assertThat(config.gsPoints()).isEqualTo(100);
    assertThat(config.convThresh()).isEqualTo(1e7);
    assertThat(config.minClusterUtility()).isEmpty();
    assertThat(config.noiseAdd()).isEqualTo(0.25);
    assertThat(config.verbosity()).isEqualTo(Verbosity.PROGRESS);
    assertThat(config.checkpointPath()).isEmpty();
    assertThat(config.parallel()).isFalse();
  }

  @Test
  public void build_noiseAddOutOfRange_throws() {
    assertThrows(
        ConfigurationException.class,
        () -> OptimizationConfig.builder().setNoiseAdd(1.5).build());
  }

  @Test
  public void build_minClusterUtilityOutOfRange_throws() {
    assertThrows(
        ConfigurationException.class,
        () -> OptimizationConfig.builder().setMinClusterUtility(-0.1).build());
  }

  @Test
  public void build_zeroBulkNew_throws() {
    assertThrows(
        ConfigurationException.class, () -> OptimizationConfig.builder().setBulkNew(0).build());
  }

  @Test
  public void clusterSettings_carryThresholdAndNoise() {
    OptimizationConfig config =
        OptimizationConfig.builder().setMinClusterUtility(0.7).setNoiseAdd(0.1).build();

    assertThat(config.clusterSettings().minClusterUtility()).hasValue(0.7);
    assertThat(config.clusterSettings().noiseAdd()).isEqualTo(0.1);
  }

  @Test
  public void fromLevel_mapsVerbosityLevels() {
    assertThat(Verbosity.fromLevel(0)).isEqualTo(Verbosity.SILENT);
    assertThat(Verbosity.fromLevel(1)).isEqualTo(Verbosity.PROGRESS);
    assertThat(Verbosity.fromLevel(2)).isEqualTo(Verbosity.DETAIL);
  }
}
