package com.verlumen.bayesopt.surrogate;

import com.google.common.flogger.FluentLogger;
import java.util.Optional;

/**
 * Lifecycle of one surrogate over a run: {@link Unfitted} until the first batch of observations
 * arrives, {@link Fitted} afterwards. Each transition returns a new state.
 */
public abstract class SurrogateState {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private SurrogateState() {}

  public static SurrogateState unfitted(SurrogateModel model, Kernel kernel) {
    return new Unfitted(model, kernel);
  }

  /** Conditions the surrogate on newly evaluated rows. */
  public abstract SurrogateState absorb(double[][] x, double[] y);

  public abstract Optional<SurrogateHandle> handle();

  public final Posterior predict(double[] x) {
    SurrogateHandle current =
        handle().orElseThrow(() -> new IllegalStateException("Surrogate has not been fitted"));
    return model().predict(current, x);
  }

  abstract SurrogateModel model();

  private static final class Unfitted extends SurrogateState {
    private final SurrogateModel model;
    private final Kernel kernel;

    private Unfitted(SurrogateModel model, Kernel kernel) {
      this.model = model;
      this.kernel = kernel;
    }

    @Override
    public SurrogateState absorb(double[][] x, double[] y) {
      logger.atFine().log("Fitting new surrogate on %d observations", x.length);
      return new Fitted(model, model.fit(kernel, x, y));
    }

    @Override
    public Optional<SurrogateHandle> handle() {
      return Optional.empty();
    }

    @Override
    SurrogateModel model() {
      return model;
    }
  }

  private static final class Fitted extends SurrogateState {
    private final SurrogateModel model;
    private final SurrogateHandle handle;

    private Fitted(SurrogateModel model, SurrogateHandle handle) {
      this.model = model;
      this.handle = handle;
    }

    @Override
    public SurrogateState absorb(double[][] x, double[] y) {
      logger.atFine().log("Updating surrogate with %d new observations", x.length);
      return new Fitted(model, model.update(handle, x, y));
    }

    @Override
    public Optional<SurrogateHandle> handle() {
      return Optional.of(handle);
    }

    @Override
    SurrogateModel model() {
      return model;
    }
  }
}
