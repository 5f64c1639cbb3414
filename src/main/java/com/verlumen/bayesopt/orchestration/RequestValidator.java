package com.verlumen.bayesopt.orchestration;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.bayesopt.acquisition.AcquisitionFunction;
import com.verlumen.bayesopt.observations.Observation;
import com.verlumen.bayesopt.observations.ObservationLog;
import com.verlumen.bayesopt.space.BoundsTable;
import java.util.Optional;

/**
 * Rejects inconsistent requests before anything is scored. Inconsistencies that do not prevent a
 * run are logged as warnings.
 */
final class RequestValidator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  RequestValidator() {}

  /** @throws ConfigurationException describing the first problem found */
  void validate(OptimizationRequest request) {
    OptimizationConfig config = request.config();
    BoundsTable bounds = request.bounds();
    Optional<ObservationLog> resumed = request.resumedLog().filter(log -> !log.isEmpty());

    AcquisitionFunction.fromName(config.acquisition());
    config.impatience().replacementFunction();

    if (!config.initialize() && resumed.isEmpty()) {
      throw new ConfigurationException(
          "initialize is false but no resumed log was supplied to start from");
    }
    if (config.initialize()) {
      if (request.initialGrid().isEmpty() && config.initPoints() <= 0) {
        throw new ConfigurationException(
            "initialize is true but neither initPoints nor an initial grid was supplied");
      }
      if (!request.initialGrid().isEmpty() && config.initPoints() > 0) {
        throw new ConfigurationException(
            "initPoints and an initial grid were both supplied; supply only one");
      }
    }
    if (config.parallel() && config.parallelism() <= 1) {
      throw new ConfigurationException(
          "parallel is true but no worker pool larger than one was registered");
    }
    if (!config.parallel() && config.parallelism() > 1) {
      logger.atWarning().log(
          "A worker pool of %d is available but parallel is false; scoring sequentially",
          config.parallelism());
    }

    if (config.initialize()) {
      checkGrid(request.initialGrid(), bounds);
    }

    boolean resumedUsable =
        resumed.map(log -> log.parameterNames().equals(bounds.names())).orElse(false);
    if (resumed.isPresent() && !resumedUsable && !config.initialize()) {
      throw new ConfigurationException(
          String.format(
              "Resumed log parameters %s do not match bounds %s",
              resumed.get().parameterNames(), bounds.names()));
    }
    if (resumedUsable) {
      checkResumed(resumed.get(), bounds);
    }

    int initialDistinct = resumedUsable ? resumed.get().distinctCount() : 0;
    if (config.initialize()) {
      initialDistinct += config.initPoints() + request.initialGrid().size();
    }
    if (initialDistinct >= config.nIters()) {
      throw new ConfigurationException(
          String.format(
              "Rows in the initial set (%d) will be larger than or equal to nIters (%d)",
              initialDistinct, config.nIters()));
    }

    if (config.parallel() && config.bulkNew() < config.parallelism()) {
      logger.atWarning().log(
          "bulkNew (%d) is less than the %d registered workers; some workers will sit idle",
          config.bulkNew(), config.parallelism());
    }
  }

  private static void checkGrid(ImmutableList<ImmutableList<Double>> grid, BoundsTable bounds) {
    int outside = 0;
    for (ImmutableList<Double> row : grid) {
      if (row.size() != bounds.dimension()) {
        throw new ConfigurationException(
            String.format(
                "Initial grid row %s has %d values but there are %d parameters",
                row, row.size(), bounds.dimension()));
      }
      if (!bounds.checkWithinBounds(row)) {
        outside++;
      }
    }
    if (outside > 0) {
      throw new BoundsViolationException("Initial grid", outside);
    }
  }

  private static void checkResumed(ObservationLog resumed, BoundsTable bounds) {
    int outside = 0;
    for (Observation row : resumed.observations()) {
      if (!bounds.checkWithinBounds(row.parameters())) {
        outside++;
      }
    }
    if (outside > 0) {
      throw new BoundsViolationException("Resumed log", outside);
    }
  }
}
