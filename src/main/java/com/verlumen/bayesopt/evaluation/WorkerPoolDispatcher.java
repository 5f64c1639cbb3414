package com.verlumen.bayesopt.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;

/** Scores candidates concurrently on a fixed pool of worker threads. */
final class WorkerPoolDispatcher implements Dispatcher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int workers;
  private final ListeningExecutorService executor;

  WorkerPoolDispatcher(int workers) {
    checkArgument(workers > 1, "A worker pool needs more than one worker: %s", workers);
    this.workers = workers;
    this.executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                workers,
                new ThreadFactoryBuilder()
                    .setNameFormat("scoring-worker-%d")
                    .setDaemon(true)
                    .build()));
  }

  @Override
  public ImmutableList<EvaluationResult> evaluate(
      ScoringFunction function, BoundsTable bounds, List<CandidatePoint> batch) {
    ImmutableList<ListenableFuture<EvaluationResult>> futures =
        batch.stream()
            .map(
                candidate ->
                    executor.submit(() -> CandidateEvaluator.evaluate(function, bounds, candidate)))
            .collect(ImmutableList.toImmutableList());
    try {
      return ImmutableList.copyOf(Futures.allAsList(futures).get());
    } catch (ExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      Throwable cause = e.getCause();
      if (cause instanceof EvaluationException) {
        throw (EvaluationException) cause;
      }
      throw new EvaluationException("Batch evaluation failed", cause);
    } catch (InterruptedException e) {
      futures.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new EvaluationException("Interrupted while waiting for batch evaluation", e);
    }
  }

  @Override
  public int workers() {
    return workers;
  }

  @Override
  public void close() {
    logger.atFine().log("Shutting down %d scoring workers", workers);
    executor.shutdownNow();
  }
}
