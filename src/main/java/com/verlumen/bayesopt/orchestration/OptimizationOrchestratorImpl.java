package com.verlumen.bayesopt.orchestration;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.bayesopt.acquisition.AcquisitionCalculator;
import com.verlumen.bayesopt.acquisition.AcquisitionFunction;
import com.verlumen.bayesopt.acquisition.AcquisitionMaximizer;
import com.verlumen.bayesopt.acquisition.AcquisitionSurface;
import com.verlumen.bayesopt.acquisition.LocalOptimum;
import com.verlumen.bayesopt.checkpoint.CheckpointStore;
import com.verlumen.bayesopt.checkpoint.CheckpointWriteException;
import com.verlumen.bayesopt.cluster.CandidateBatch;
import com.verlumen.bayesopt.cluster.CandidateClusterer;
import com.verlumen.bayesopt.evaluation.Dispatcher;
import com.verlumen.bayesopt.evaluation.DispatcherFactory;
import com.verlumen.bayesopt.evaluation.EvaluationException;
import com.verlumen.bayesopt.evaluation.EvaluationResult;
import com.verlumen.bayesopt.observations.Observation;
import com.verlumen.bayesopt.observations.ObservationLog;
import com.verlumen.bayesopt.observations.ObservationSchema;
import com.verlumen.bayesopt.space.BoundsTable;
import com.verlumen.bayesopt.space.CandidatePoint;
import com.verlumen.bayesopt.space.SpaceFillingSampler;
import com.verlumen.bayesopt.surrogate.SurrogateModel;
import com.verlumen.bayesopt.surrogate.SurrogateState;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Sequential model-based optimization loop. Each iteration conditions the surrogates on the rows
 * scored in the previous iteration, maximizes the acquisition surface from many starting points,
 * reduces the local optima to a batch of new candidates and scores that batch. The loop stops once
 * {@code nIters} distinct parameter sets have been scored.
 */
final class OptimizationOrchestratorImpl implements OptimizationOrchestrator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RequestValidator validator;
  private final SpaceFillingSampler sampler;
  private final SurrogateModel surrogateModel;
  private final AcquisitionCalculator calculator;
  private final AcquisitionMaximizer maximizer;
  private final CandidateClusterer clusterer;
  private final DispatcherFactory dispatcherFactory;
  private final CheckpointStore checkpointStore;

  @Inject
  OptimizationOrchestratorImpl(
      RequestValidator validator,
      SpaceFillingSampler sampler,
      SurrogateModel surrogateModel,
      AcquisitionCalculator calculator,
      AcquisitionMaximizer maximizer,
      CandidateClusterer clusterer,
      DispatcherFactory dispatcherFactory,
      CheckpointStore checkpointStore) {
    this.validator = validator;
    this.sampler = sampler;
    this.surrogateModel = surrogateModel;
    this.calculator = calculator;
    this.maximizer = maximizer;
    this.clusterer = clusterer;
    this.dispatcherFactory = dispatcherFactory;
    this.checkpointStore = checkpointStore;
  }

  @Override
  public OptimizationResult run(OptimizationRequest request) {
    validator.validate(request);
    OptimizationConfig config = request.config();
    BoundsTable bounds = request.bounds();
    Verbosity verbosity = config.verbosity();
    IterationState state =
        new IterationState(
            AcquisitionFunction.fromName(config.acquisition()), Stopwatch.createStarted());

    try (Dispatcher dispatcher =
        dispatcherFactory.create(config.parallel(), config.parallelism())) {
      ObservationLog log = initialObservations(request, dispatcher);
      checkpoint(config, log, state);
      state.recordBest(log);

      double scoreScale = scaleOf(log.maxAbsScore());
      double elapsedScale = scaleOf(log.maxElapsed());
      SurrogateState scoreSurrogate = SurrogateState.unfitted(surrogateModel, config.kernel());
      Optional<SurrogateState> elapsedSurrogate = Optional.empty();

      while (log.distinctCount() < config.nIters()) {
        int iteration = state.advance();
        int batchSize = Math.min(config.nIters() - log.distinctCount(), config.bulkNew());

        AcquisitionFunction acquisition =
            config.impatience().apply(state.acquisition(), log.distinctCount());
        if (acquisition != state.acquisition()) {
          if (verbosity.showsProgress()) {
            logger.atInfo().log(
                "%d distinct parameter sets scored; switching acquisition from %s to %s",
                log.distinctCount(), state.acquisition().shortName(), acquisition.shortName());
          }
          state.setAcquisition(acquisition);
        }

        if (verbosity.showsProgress()) {
          logger.atInfo().log("Starting iteration %d", iteration);
          logger.atInfo().log("  1) Fitting Gaussian process");
        }
        ImmutableList<Observation> newRows = log.atIteration(iteration - 1);
        double[][] x = scaledParameters(bounds, newRows);
        scoreSurrogate = scoreSurrogate.absorb(x, column(newRows, Observation::score, scoreScale));
        if (acquisition.requiresElapsedModel()) {
          // A fresh elapsed surrogate has to see every row, not just the latest batch.
          List<Observation> elapsedRows =
              elapsedSurrogate.isPresent() ? newRows : log.observations();
          elapsedSurrogate =
              Optional.of(
                  elapsedSurrogate
                      .orElseGet(() -> SurrogateState.unfitted(surrogateModel, config.kernel()))
                      .absorb(
                          scaledParameters(bounds, elapsedRows),
                          column(elapsedRows, Observation::elapsedSeconds, elapsedScale)));
        } else {
          elapsedSurrogate = Optional.empty();
        }

        if (verbosity.showsProgress()) {
          logger.atInfo().log(
              "  2) Running local optimum search from %d starting points", config.gsPoints());
        }
        double yMax = log.best().get().score() / scoreScale;
        AcquisitionSurface surface =
            AcquisitionSurface.of(
                calculator,
                acquisition,
                scoreSurrogate,
                elapsedSurrogate,
                yMax,
                config.acquisitionParams());
        ImmutableList<LocalOptimum> optima =
            maximizer.maximize(surface, bounds, config.gsPoints(), config.convThresh());
        CandidateBatch batch =
            clusterer.select(
                bounds, optima, batchSize, config.clusterSettings(), log.distinctParameters());
        state.recordOptima(
            IterationOptima.create(
                iteration, acquisition, optima, batch.seeds(), batch.candidates()));

        if (verbosity.showsProgress()) {
          logger.atInfo().log(
              "  3) Running scoring function %d times in %d thread(s)",
              batch.candidates().size(), dispatcher.workers());
        }
        ImmutableList<EvaluationResult> results =
            dispatcher.evaluate(request.scoringFunction(), bounds, batch.candidates());
        ImmutableList<Observation> scored = toObservations(iteration, bounds, log, results);
        log.append(scored);

        boolean improved = state.recordBest(log);
        if (verbosity.showsDetail()) {
          scored.forEach(row -> logger.atInfo().log("    %s", describe(bounds, row)));
          if (improved) {
            logger.atInfo().log(
                "  New best parameter set found: %s", describe(bounds, log.best().get()));
          } else {
            logger.atInfo().log("  Maximum score was not raised this round");
          }
        }
        checkpoint(config, log, state);
      }

      return OptimizationResult.builder()
          .setScoreSurrogate(scoreSurrogate.handle().get())
          .setElapsedSurrogate(elapsedSurrogate.flatMap(SurrogateState::handle))
          .setHistory(state.history())
          .setSchema(log.schema().get())
          .setObservations(log.observations())
          .setBestSnapshots(state.bestSnapshots())
          .setCheckpointSaves(state.checkpointSaves())
          .build();
    }
  }

  /** Scores the initial design and merges or adopts the resumed log. All rows get iteration 0. */
  private ObservationLog initialObservations(OptimizationRequest request, Dispatcher dispatcher) {
    OptimizationConfig config = request.config();
    BoundsTable bounds = request.bounds();
    Optional<ObservationLog> resumed = request.resumedLog().filter(log -> !log.isEmpty());

    if (!config.initialize()) {
      ObservationLog log = ObservationLog.create(resumed.get().schema().get());
      log.append(atIterationZero(resumed.get()));
      if (config.verbosity().showsProgress()) {
        logger.atInfo().log("Starting from %d resumed observations", log.size());
      }
      return log;
    }

    ImmutableList<CandidatePoint> design =
        (request.initialGrid().isEmpty()
                ? sampler.sample(bounds, config.initPoints())
                : request.initialGrid())
            .stream()
            .map(raw -> CandidatePoint.fromRaw(bounds, raw))
            .collect(ImmutableList.toImmutableList());
    if (config.verbosity().showsProgress()) {
      logger.atInfo().log(
          "Running initial scoring function %d times in %d thread(s)",
          design.size(), dispatcher.workers());
    }
    ObservationLog log = ObservationLog.create(bounds.names());
    log.append(
        toObservations(
            0, bounds, log, dispatcher.evaluate(request.scoringFunction(), bounds, design)));

    if (resumed.isPresent()) {
      ObservationLog previous = resumed.get();
      if (previous.parameterNames().equals(bounds.names())
          && previous.schema().get().sameColumnsAs(log.schema().get())) {
        log.append(atIterationZero(previous));
        if (config.verbosity().showsProgress()) {
          logger.atInfo().log("Merged %d resumed observations", previous.size());
        }
      } else {
        logger.atWarning().log(
            "Resumed log columns %s do not match columns %s of the new observations;"
                + " continuing without them",
            previous.schema().get().columns(), log.schema().get().columns());
      }
    }
    return log;
  }

  private static ImmutableList<Observation> atIterationZero(ObservationLog log) {
    return log.observations().stream()
        .map(row -> row.withIteration(0))
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<Observation> toObservations(
      int iteration,
      BoundsTable bounds,
      ObservationLog log,
      ImmutableList<EvaluationResult> results) {
    Set<String> expected =
        log.schema()
            .<Set<String>>map(schema -> ImmutableSet.copyOf(schema.extraNames()))
            .orElse(results.get(0).result().extras().keySet());
    ImmutableList.Builder<Observation> rows = ImmutableList.builder();
    for (EvaluationResult result : results) {
      ImmutableMap<String, Double> extras = result.result().extras();
      if (!extras.keySet().equals(expected) || clashes(extras.keySet(), bounds)) {
        throw new EvaluationException(
            bounds.toNamedValues(result.candidate().raw()),
            new IllegalArgumentException(
                String.format(
                    "Scoring function returned extra values %s; expected %s, none of them"
                        + " named like a parameter or %s",
                    extras.keySet(), expected, ObservationSchema.RESERVED)));
      }
      rows.add(
          Observation.create(
              iteration,
              result.candidate().raw(),
              result.elapsedSeconds(),
              result.result().score(),
              extras));
    }
    return rows.build();
  }

  private static boolean clashes(Set<String> extraNames, BoundsTable bounds) {
    for (String name : extraNames) {
      if (ObservationSchema.RESERVED.contains(name) || bounds.names().contains(name)) {
        return true;
      }
    }
    return false;
  }

  private void checkpoint(OptimizationConfig config, ObservationLog log, IterationState state) {
    if (config.checkpointPath().isEmpty()) {
      return;
    }
    Path path = config.checkpointPath().get();
    try {
      checkpointStore.save(path, log);
      int saves = state.checkpointSaved();
      if (config.verbosity().showsProgress()) {
        logger.atInfo().log(
            "Saved %d observations to %s (save number %d)", log.size(), path, saves);
      }
    } catch (CheckpointWriteException e) {
      logger.atWarning().withCause(e).log(
          "Failed to save intermediate results to %s; check the checkpoint path", path);
    }
  }

  private static double[][] scaledParameters(BoundsTable bounds, List<Observation> rows) {
    double[][] x = new double[rows.size()][];
    for (int i = 0; i < rows.size(); i++) {
      x[i] = CandidatePoint.fromRaw(bounds, rows.get(i).parameters()).scaledArray();
    }
    return x;
  }

  private static double[] column(
      List<Observation> rows, ToDoubleFunction<Observation> value, double scale) {
    return rows.stream().mapToDouble(row -> value.applyAsDouble(row) / scale).toArray();
  }

  /** Divisor that maps the largest magnitude of a column to 1; 1 if the column is all zero. */
  private static double scaleOf(double maxMagnitude) {
    return maxMagnitude > 0 ? maxMagnitude : 1.0;
  }

  private static String describe(BoundsTable bounds, Observation row) {
    return String.format(
        "%s score=%s elapsed=%.3fs%s",
        bounds.toNamedValues(row.parameters()),
        row.score(),
        row.elapsedSeconds(),
        row.extras().isEmpty() ? "" : " " + row.extras());
  }
}
