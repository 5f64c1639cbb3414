package com.verlumen.bayesopt.evaluation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import com.verlumen.bayesopt.space.ParameterSpec;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class WorkerPoolDispatcherTest {
  private static final BoundsTable BOUNDS = BoundsTable.of(ParameterSpec.continuous("x", 0, 10));

  private final WorkerPoolDispatcher dispatcher = new WorkerPoolDispatcher(3);

  @After
  public void tearDown() {
    dispatcher.close();
  }

  @Test
  public void evaluate_runsConcurrentlyAndKeepsBatchOrder() {
    CountDownLatch allStarted = new CountDownLatch(3);
    ScoringFunction function =
        parameters -> {
          allStarted.countDown();
          // Only completes if all three candidates are being scored at the same time.
          if (!allStarted.await(10, TimeUnit.SECONDS)) {
            throw new IllegalStateException("Candidates were not scored concurrently");
          }
          Thread.sleep((long) (10 * (10 - parameters.get("x"))));
          return ScoreResult.of(parameters.get("x"));
        };

    ImmutableList<EvaluationResult> results =
        dispatcher.evaluate(function, BOUNDS, ImmutableList.of(point(1.0), point(5.0), point(9.0)));

    assertThat(results.stream().mapToDouble(result -> result.result().score()).toArray())
        .usingExactEquality()
        .containsExactly(1.0, 5.0, 9.0)
        .inOrder();
  }

  @Test
  public void evaluate_oneFailure_failsWholeBatch() {
    ScoringFunction function =
        parameters -> {
          if (parameters.get("x") > 4) {
            throw new IllegalArgumentException("too large");
          }
          return ScoreResult.of(1.0);
        };

    EvaluationException e =
        assertThrows(
            EvaluationException.class,
            () -> dispatcher.evaluate(function, BOUNDS, ImmutableList.of(point(1.0), point(5.0))));

    assertThat(e).hasCauseThat().isInstanceOf(IllegalArgumentException.class);
    assertThat(e.parameters()).containsExactly("x", 5.0);
  }

  @Test
  public void workers_reportsPoolSize() {
    assertThat(dispatcher.workers()).isEqualTo(3);
  }

  @Test
  public void create_singleWorker_throws() {
    assertThrows(IllegalArgumentException.class, () -> new WorkerPoolDispatcher(1));
  }

  @Test
  public void factory_choosesDispatcherByParallelFlag() {
    DispatcherFactoryImpl factory = new DispatcherFactoryImpl();

    try (Dispatcher sequential = factory.create(false, 4);
        Dispatcher pooled = factory.create(true, 4)) {
      assertThat(sequential).isInstanceOf(SequentialDispatcher.class);
      assertThat(pooled.workers()).isEqualTo(4);
    }
  }

  private static CandidatePoint point(double x) {
    return CandidatePoint.fromRaw(BOUNDS, ImmutableList.of(x));
  }
}
