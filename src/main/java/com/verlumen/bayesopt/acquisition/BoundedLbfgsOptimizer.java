package com.verlumen.bayesopt.acquisition;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.ToDoubleFunction;

/**
 * Box-constrained limited-memory BFGS minimizer.
 *
 * <p>Search directions come from the L-BFGS two-loop recursion with components that would leave
 * the box zeroed; trial points are projected back onto the box and accepted under an Armijo
 * condition. Gradients are central finite differences, one-sided at the bounds.
 *
 * <p>Convergence follows the {@code factr} convention of L-BFGS-B: iteration stops once the
 * relative reduction of the objective falls below {@code factr} times machine epsilon.
 */
final class BoundedLbfgsOptimizer {
  static final int DEFAULT_MEMORY = 5;
  static final int DEFAULT_MAX_ITERATIONS = 100;

  private static final double MACHINE_EPSILON = Math.ulp(1.0);
  private static final double FINITE_DIFFERENCE_STEP = 1e-3;
  private static final double PROJECTED_GRADIENT_TOLERANCE = 1e-10;
  private static final double ARMIJO_COEFFICIENT = 1e-4;
  private static final int MAX_LINE_SEARCH_STEPS = 30;
  private static final double CURVATURE_TOLERANCE = 1e-12;

  private final double factr;
  private final int memory;
  private final int maxIterations;

  BoundedLbfgsOptimizer(double factr) {
    this(factr, DEFAULT_MEMORY, DEFAULT_MAX_ITERATIONS);
  }

  BoundedLbfgsOptimizer(double factr, int memory, int maxIterations) {
    checkArgument(factr > 0, "factr must be positive: %s", factr);
    checkArgument(memory > 0, "memory must be positive: %s", memory);
    checkArgument(maxIterations > 0, "maxIterations must be positive: %s", maxIterations);
    this.factr = factr;
    this.memory = memory;
    this.maxIterations = maxIterations;
  }

  /** Outcome of one local minimization. */
  record Result(
      double[] point, double value, int iterations, int gradientEvaluations, boolean converged) {}

  Result minimize(
      ToDoubleFunction<double[]> objective, double[] start, double[] lower, double[] upper) {
    checkArgument(
        start.length == lower.length && start.length == upper.length,
        "Start point and bounds must have the same dimension");
    int n = start.length;
    double[] x = project(start, lower, upper);
    double f = objective.applyAsDouble(x.clone());
    double[] g = gradient(objective, x, lower, upper);
    int gradientEvaluations = 1;
    int iterations = 0;
    boolean converged = false;

    Deque<double[]> sHistory = new ArrayDeque<>();
    Deque<double[]> yHistory = new ArrayDeque<>();

    while (iterations < maxIterations) {
      if (projectedGradientNorm(x, g, lower, upper) <= PROJECTED_GRADIENT_TOLERANCE) {
        converged = true;
        break;
      }

      double[] d = direction(g, sHistory, yHistory);
      blockInfeasible(d, x, lower, upper);
      double slope = dot(g, d);
      if (slope >= 0.0) {
        // Curvature history no longer yields descent; restart from steepest descent.
        sHistory.clear();
        yHistory.clear();
        for (int i = 0; i < n; i++) {
          d[i] = -g[i];
        }
        blockInfeasible(d, x, lower, upper);
        if (dot(g, d) >= 0.0) {
          converged = true;
          break;
        }
      }

      double step = sHistory.isEmpty() ? Math.min(1.0, 1.0 / infinityNorm(d)) : 1.0;
      double[] next = null;
      double fNext = f;
      for (int k = 0; k < MAX_LINE_SEARCH_STEPS; k++) {
        double[] trial = new double[n];
        for (int i = 0; i < n; i++) {
          trial[i] = x[i] + step * d[i];
        }
        trial = project(trial, lower, upper);
        double fTrial = objective.applyAsDouble(trial.clone());
        double decrease = 0.0;
        for (int i = 0; i < n; i++) {
          decrease += g[i] * (trial[i] - x[i]);
        }
        if (decrease < 0.0 && fTrial <= f + ARMIJO_COEFFICIENT * decrease) {
          next = trial;
          fNext = fTrial;
          break;
        }
        step *= 0.5;
      }
      if (next == null) {
        converged = true;
        break;
      }

      double[] gNext = gradient(objective, next, lower, upper);
      gradientEvaluations++;
      iterations++;

      double[] s = new double[n];
      double[] y = new double[n];
      for (int i = 0; i < n; i++) {
        s[i] = next[i] - x[i];
        y[i] = gNext[i] - g[i];
      }
      if (dot(s, y) > CURVATURE_TOLERANCE) {
        sHistory.addLast(s);
        yHistory.addLast(y);
        if (sHistory.size() > memory) {
          sHistory.removeFirst();
          yHistory.removeFirst();
        }
      }

      double relativeReduction =
          (f - fNext) / Math.max(Math.max(Math.abs(f), Math.abs(fNext)), 1.0);
      x = next;
      f = fNext;
      g = gNext;
      if (relativeReduction <= factr * MACHINE_EPSILON) {
        converged = true;
        break;
      }
    }
    return new Result(x, f, iterations, gradientEvaluations, converged);
  }

  /** Two-loop recursion: returns {@code -H g} for the current inverse Hessian estimate. */
  private static double[] direction(
      double[] g, Deque<double[]> sHistory, Deque<double[]> yHistory) {
    int n = g.length;
    double[] q = g.clone();
    int m = sHistory.size();
    double[] alpha = new double[m];
    double[] rho = new double[m];
    double[][] s = sHistory.toArray(new double[0][]);
    double[][] y = yHistory.toArray(new double[0][]);

    for (int k = m - 1; k >= 0; k--) {
      rho[k] = 1.0 / dot(y[k], s[k]);
      alpha[k] = rho[k] * dot(s[k], q);
      for (int i = 0; i < n; i++) {
        q[i] -= alpha[k] * y[k][i];
      }
    }
    double gamma = m == 0 ? 1.0 : dot(s[m - 1], y[m - 1]) / dot(y[m - 1], y[m - 1]);
    for (int i = 0; i < n; i++) {
      q[i] *= gamma;
    }
    for (int k = 0; k < m; k++) {
      double beta = rho[k] * dot(y[k], q);
      for (int i = 0; i < n; i++) {
        q[i] += s[k][i] * (alpha[k] - beta);
      }
    }
    for (int i = 0; i < n; i++) {
      q[i] = -q[i];
    }
    return q;
  }

  private static double[] gradient(
      ToDoubleFunction<double[]> objective, double[] x, double[] lower, double[] upper) {
    double[] g = new double[x.length];
    double[] probe = x.clone();
    for (int i = 0; i < x.length; i++) {
      double up = Math.min(upper[i], x[i] + FINITE_DIFFERENCE_STEP);
      double down = Math.max(lower[i], x[i] - FINITE_DIFFERENCE_STEP);
      probe[i] = up;
      double fUp = objective.applyAsDouble(probe.clone());
      probe[i] = down;
      double fDown = objective.applyAsDouble(probe.clone());
      probe[i] = x[i];
      g[i] = up > down ? (fUp - fDown) / (up - down) : 0.0;
    }
    return g;
  }

  private static void blockInfeasible(double[] d, double[] x, double[] lower, double[] upper) {
    for (int i = 0; i < d.length; i++) {
      if ((x[i] <= lower[i] && d[i] < 0.0) || (x[i] >= upper[i] && d[i] > 0.0)) {
        d[i] = 0.0;
      }
    }
  }

  private static double projectedGradientNorm(
      double[] x, double[] g, double[] lower, double[] upper) {
    double norm = 0.0;
    for (int i = 0; i < x.length; i++) {
      double moved = Math.min(upper[i], Math.max(lower[i], x[i] - g[i]));
      norm = Math.max(norm, Math.abs(moved - x[i]));
    }
    return norm;
  }

  private static double[] project(double[] x, double[] lower, double[] upper) {
    double[] projected = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      projected[i] = Math.min(upper[i], Math.max(lower[i], x[i]));
    }
    return projected;
  }

  private static double infinityNorm(double[] v) {
    double norm = 0.0;
    for (double value : v) {
      norm = Math.max(norm, Math.abs(value));
    }
    return norm;
  }

  private static double dot(double[] a, double[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += a[i] * b[i];
    }
    return sum;
  }
}
