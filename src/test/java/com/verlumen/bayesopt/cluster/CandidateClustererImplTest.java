package com.verlumen.bayesopt.cluster;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Doubles;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.bayesopt.acquisition.LocalOptimum;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import com.verlumen.bayesopt.space.ParameterSpec;
import com.verlumen.bayesopt.space.SamplingMode;
import com.verlumen.bayesopt.space.SpaceFillingSampler;
import java.util.Optional;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class CandidateClustererImplTest {
  private static final BoundsTable BOUNDS =
      BoundsTable.of(ParameterSpec.continuous("a", 0, 10), ParameterSpec.continuous("b", 0, 10));
  private static final ClusterSettings DEFAULTS =
      ClusterSettings.create(Optional.empty(), ClusterSettings.DEFAULT_NOISE_ADD);

  @Rule public MockitoRule rule = MockitoJUnit.rule();

  @Mock @Bind private SpaceFillingSampler mockSampler;
  @Bind private RandomGenerator random = new Well19937c(7);

  @Inject private CandidateClustererImpl clusterer;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void retain_withoutThreshold_keepsOnlyGlobalMaximum() {
    LocalOptimum best = optimum(0.2, 0.2, 3.0);

    assertThat(
            CandidateClustererImpl.retain(
                ImmutableList.of(optimum(0.8, 0.8, 1.0), best), Optional.empty()))
        .containsExactly(best);
  }

  @Test
  public void retain_withThreshold_keepsOptimaWithinFractionOfBest() {
    LocalOptimum best = optimum(0.1, 0.1, 1.0);
    LocalOptimum close = optimum(0.5, 0.5, 0.6);
    LocalOptimum weak = optimum(0.9, 0.9, 0.4);

    assertThat(
            CandidateClustererImpl.retain(ImmutableList.of(weak, close, best), Optional.of(0.5)))
        .containsExactly(best, close)
        .inOrder();
  }

  @Test
  public void retain_negativeUtilities_cutoffStaysBelowBest() {
    LocalOptimum best = optimum(0.1, 0.1, -1.0);
    LocalOptimum close = optimum(0.5, 0.5, -1.4);
    LocalOptimum weak = optimum(0.9, 0.9, -3.0);

    assertThat(
            CandidateClustererImpl.retain(ImmutableList.of(weak, close, best), Optional.of(0.5)))
        .containsExactly(best, close)
        .inOrder();
  }

  @Test
  public void deduplicate_dropsOptimaWithinTolerance() {
    LocalOptimum best = optimum(0.5, 0.5, 2.0);
    LocalOptimum twin = optimum(0.503, 0.5, 1.9);
    LocalOptimum other = optimum(0.2, 0.5, 1.0);

    assertThat(CandidateClustererImpl.deduplicate(ImmutableList.of(best, twin, other)))
        .containsExactly(best, other)
        .inOrder();
  }

  @Test
  public void allocate_fewerExtrasThanSeeds_favoursBestSeeds() {
    ImmutableList<LocalOptimum> seeds =
        ImmutableList.of(optimum(0.1, 0.1, 3.0), optimum(0.5, 0.5, 1.0), optimum(0.9, 0.9, 0.0));

    assertThat(CandidateClustererImpl.allocate(seeds, 2)).asList().containsExactly(1, 1, 0);
  }

  @Test
  public void allocate_moreExtrasThanSeeds_followsUtility() {
    ImmutableList<LocalOptimum> seeds =
        ImmutableList.of(optimum(0.1, 0.1, 3.0), optimum(0.5, 0.5, 1.0), optimum(0.9, 0.9, 0.0));

    assertThat(CandidateClustererImpl.allocate(seeds, 7))
        .asList()
        .containsExactly(4, 2, 1)
        .inOrder();
  }

  @Test
  public void select_defaultSettings_fillsBatchAroundGlobalOptimum() {
    LocalOptimum best = optimum(0.5, 0.3, 2.0);

    CandidateBatch batch =
        clusterer.select(
            BOUNDS,
            ImmutableList.of(optimum(0.9, 0.9, 1.0), best),
            5,
            DEFAULTS,
            ImmutableSet.of());

    assertThat(batch.seeds()).containsExactly(best);
    assertThat(batch.candidates()).hasSize(5);
    assertThat(batch.candidates().get(0)).isEqualTo(best.point());
    assertThat(ImmutableSet.copyOf(batch.candidates())).hasSize(5);
    for (CandidatePoint candidate : batch.candidates()) {
      assertThat(candidate.raw().get(0)).isWithin(2.5 + 1e-9).of(5.0);
      assertThat(candidate.raw().get(1)).isWithin(2.5 + 1e-9).of(3.0);
    }
    verifyNoInteractions(mockSampler);
  }

  @Test
  public void select_optimumAlreadyEvaluated_returnsOnlyNewPoints() {
    LocalOptimum best = optimum(0.5, 0.5, 2.0);

    CandidateBatch batch =
        clusterer.select(
            BOUNDS, ImmutableList.of(best), 3, DEFAULTS, ImmutableSet.of(best.point().raw()));

    assertThat(batch.candidates()).hasSize(3);
    assertThat(batch.candidates()).doesNotContain(best.point());
  }

  @Test
  public void select_noRoomNearOptimum_fallsBackToSampler() {
    BoundsTable counts = BoundsTable.of(ParameterSpec.integer("n", 0, 2));
    LocalOptimum best =
        LocalOptimum.create(CandidatePoint.fromRaw(counts, ImmutableList.of(1.0)), 1.0, 4);
    ImmutableSet<ImmutableList<Double>> evaluated = ImmutableSet.of(ImmutableList.of(1.0));
    when(mockSampler.sample(eq(counts), eq(2), any(), eq(SamplingMode.STRICT)))
        .thenReturn(ImmutableList.of(ImmutableList.of(0.0), ImmutableList.of(2.0)));

    CandidateBatch batch =
        clusterer.select(counts, ImmutableList.of(best), 2, DEFAULTS, evaluated);

    assertThat(batch.candidates().stream().map(CandidatePoint::raw).collect(toImmutableList()))
        .containsExactly(ImmutableList.of(0.0), ImmutableList.of(2.0));
  }

  @Test
  public void select_emptyOptima_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> clusterer.select(BOUNDS, ImmutableList.of(), 1, DEFAULTS, ImmutableSet.of()));
  }

  private static LocalOptimum optimum(double a, double b, double value) {
    return LocalOptimum.create(
        CandidatePoint.fromScaled(BOUNDS, Doubles.toArray(ImmutableList.of(a, b))), value, 5);
  }
}
