package com.verlumen.bayesopt.surrogate;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.util.Arrays;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Constant-mean Gaussian process regression.
 *
 * <p>The process variance and mean are profiled out of the likelihood; the nugget and the kernel
 * lengthscale are chosen by maximizing the concentrated log marginal likelihood over a grid.
 * {@link #fit} searches a wide lengthscale grid around the kernel's starting beta, {@link
 * #update} only a narrow neighbourhood of the current estimate.
 */
final class GaussianProcessModel implements SurrogateModel {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final ImmutableList<Double> NUGGETS =
      ImmutableList.of(1e-8, 1e-6, 1e-4, 1e-3, 1e-2, 1e-1);
  private static final double FIT_BETA_STEP = 0.5;
  private static final int FIT_BETA_STEPS = 6;
  private static final int UPDATE_BETA_STEPS = 1;
  private static final double MIN_PROCESS_VARIANCE = 1e-12;

  @Inject
  GaussianProcessModel() {}

  @Override
  public SurrogateHandle fit(Kernel kernel, double[][] x, double[] y) {
    checkData(x, y);
    return estimate(kernel, copy(x), y.clone(), FIT_BETA_STEPS);
  }

  @Override
  public SurrogateHandle update(SurrogateHandle handle, double[][] xNew, double[] yNew) {
    checkData(xNew, yNew);
    checkArgument(
        handle instanceof GaussianProcessHandle,
        "Handle was not produced by this model: %s",
        handle);
    GaussianProcessHandle previous = (GaussianProcessHandle) handle;
    double[][] x = new double[previous.x.length + xNew.length][];
    double[] y = new double[previous.y.length + yNew.length];
    System.arraycopy(previous.x, 0, x, 0, previous.x.length);
    System.arraycopy(copy(xNew), 0, x, previous.x.length, xNew.length);
    System.arraycopy(previous.y, 0, y, 0, previous.y.length);
    System.arraycopy(yNew, 0, y, previous.y.length, yNew.length);
    return estimate(previous.kernel(), x, y, UPDATE_BETA_STEPS);
  }

  @Override
  public Posterior predict(SurrogateHandle handle, double[] point) {
    checkArgument(
        handle instanceof GaussianProcessHandle,
        "Handle was not produced by this model: %s",
        handle);
    GaussianProcessHandle gp = (GaussianProcessHandle) handle;
    RealVector r = new ArrayRealVector(gp.x.length);
    for (int i = 0; i < gp.x.length; i++) {
      r.setEntry(i, gp.kernel().correlation(point, gp.x[i]));
    }
    double mean = gp.mean + r.dotProduct(gp.weights);
    double explained = r.dotProduct(gp.solver.solve(r));
    double variance = Math.max(0.0, gp.processVariance * (1.0 - explained));
    return new Posterior(mean, variance);
  }

  private GaussianProcessHandle estimate(Kernel start, double[][] x, double[] y, int betaSteps) {
    GaussianProcessHandle best = null;
    for (int step = -betaSteps; step <= betaSteps; step++) {
      Kernel kernel = start.withBeta(start.beta() + step * FIT_BETA_STEP);
      for (double nugget : NUGGETS) {
        GaussianProcessHandle candidate = condition(kernel, nugget, x, y);
        if (candidate != null
            && (best == null || candidate.logLikelihood > best.logLikelihood)) {
          best = candidate;
        }
      }
    }
    if (best == null) {
      throw new IllegalStateException(
          "Covariance matrix was not positive definite for any nugget on "
              + x.length
              + " observations");
    }
    logger.atFine().log(
        "Selected beta=%.2f nugget=%.1e on %d observations (log likelihood %.4f)",
        best.kernel().beta(), best.nugget, x.length, best.logLikelihood);
    return best;
  }

  /** Conditions the process on the data, or returns null if the correlation matrix is singular. */
  private static GaussianProcessHandle condition(
      Kernel kernel, double nugget, double[][] x, double[] y) {
    int n = x.length;
    RealMatrix correlation = new Array2DRowRealMatrix(n, n);
    for (int i = 0; i < n; i++) {
      correlation.setEntry(i, i, 1.0 + nugget);
      for (int j = 0; j < i; j++) {
        double c = kernel.correlation(x[i], x[j]);
        correlation.setEntry(i, j, c);
        correlation.setEntry(j, i, c);
      }
    }

    CholeskyDecomposition cholesky;
    try {
      cholesky = new CholeskyDecomposition(correlation);
    } catch (NonPositiveDefiniteMatrixException e) {
      return null;
    }
    DecompositionSolver solver = cholesky.getSolver();

    RealVector ones = new ArrayRealVector(n, 1.0);
    RealVector observed = new ArrayRealVector(y);
    RealVector onesSolved = solver.solve(ones);
    double mean = onesSolved.dotProduct(observed) / onesSolved.dotProduct(ones);
    RealVector residual = observed.mapSubtract(mean);
    RealVector weights = solver.solve(residual);
    double processVariance = Math.max(MIN_PROCESS_VARIANCE, residual.dotProduct(weights) / n);

    double logDeterminant = 0.0;
    RealMatrix lower = cholesky.getL();
    for (int i = 0; i < n; i++) {
      logDeterminant += 2.0 * Math.log(lower.getEntry(i, i));
    }
    double logLikelihood = -0.5 * n * Math.log(processVariance) - 0.5 * logDeterminant;

    return new GaussianProcessHandle(
        kernel, nugget, x, y, mean, processVariance, solver, weights, logLikelihood);
  }

  private static void checkData(double[][] x, double[] y) {
    checkArgument(x.length > 0, "At least one observation is required");
    checkArgument(
        x.length == y.length, "Got %s input rows but %s responses", x.length, y.length);
    for (double value : y) {
      checkArgument(Double.isFinite(value), "Responses must be finite: %s", Arrays.toString(y));
    }
  }

  private static double[][] copy(double[][] x) {
    double[][] copy = new double[x.length][];
    for (int i = 0; i < x.length; i++) {
      copy[i] = x[i].clone();
    }
    return copy;
  }

  private static final class GaussianProcessHandle implements SurrogateHandle {
    private final Kernel kernel;
    private final double nugget;
    private final double[][] x;
    private final double[] y;
    private final double mean;
    private final double processVariance;
    private final DecompositionSolver solver;
    private final RealVector weights;
    private final double logLikelihood;

    private GaussianProcessHandle(
        Kernel kernel,
        double nugget,
        double[][] x,
        double[] y,
        double mean,
        double processVariance,
        DecompositionSolver solver,
        RealVector weights,
        double logLikelihood) {
      this.kernel = kernel;
      this.nugget = nugget;
      this.x = x;
      this.y = y;
      this.mean = mean;
      this.processVariance = processVariance;
      this.solver = solver;
      this.weights = weights;
      this.logLikelihood = logLikelihood;
    }

    @Override
    public Kernel kernel() {
      return kernel;
    }

    @Override
    public int observationCount() {
      return x.length;
    }

    @Override
    public String toString() {
      return String.format(
          "GaussianProcess{kernel=%s, beta=%.2f, nugget=%.1e, n=%d}",
          kernel.kind().displayName(), kernel.beta(), nugget, x.length);
    }
  }
}
